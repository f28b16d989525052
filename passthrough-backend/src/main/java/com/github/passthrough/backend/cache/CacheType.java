package com.github.passthrough.backend.cache;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The independent caches which back the stream resolution.
 */
@Getter
@RequiredArgsConstructor
public enum CacheType {
    METADATA("metadata"),
    SEARCH_RESULTS("torrentSearch"),
    STREAMS("streams");

    private final String key;
}
