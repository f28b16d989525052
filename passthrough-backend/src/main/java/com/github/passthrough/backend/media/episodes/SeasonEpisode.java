package com.github.passthrough.backend.media.episodes;

import lombok.Value;

@Value
public class SeasonEpisode {
    int season;
    int episode;

    /**
     * Get the tag of this season episode, e.g. {@code S6E3}.
     *
     * @return Returns the short tag.
     */
    public String getTag() {
        return "S" + season + "E" + episode;
    }
}
