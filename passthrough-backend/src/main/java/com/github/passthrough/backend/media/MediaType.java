package com.github.passthrough.backend.media;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum MediaType {
    MOVIE("movie"),
    SERIES("series");

    /**
     * The key of the type within the catalog and aggregator API's.
     */
    private final String key;

    /**
     * Get the media type for the given API key.
     *
     * @param key The key of the type.
     * @return Returns the media type if known, else {@link Optional#empty()}.
     */
    public static Optional<MediaType> fromKey(String key) {
        return Arrays.stream(values())
                .filter(e -> e.getKey().equalsIgnoreCase(key))
                .findFirst();
    }
}
