package com.github.passthrough.backend.media.episodes;

import com.github.passthrough.backend.torrent.models.TorrentCandidate;
import lombok.Value;

/**
 * A torrent candidate which has been scored against the requested episode.
 */
@Value
public class ScoredCandidate {
    TorrentCandidate candidate;
    int matchScore;
    boolean matches;

    public static ScoredCandidate score(TorrentCandidate candidate, SeasonEpisode seasonEpisode) {
        var title = candidate.getTitle();
        var season = seasonEpisode.getSeason();
        var episode = seasonEpisode.getEpisode();

        return new ScoredCandidate(candidate,
                EpisodeMatcher.getEpisodeMatchScore(title, season, episode),
                EpisodeMatcher.matchesEpisode(title, season, episode));
    }
}
