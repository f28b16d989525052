package com.github.passthrough.backend.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.passthrough.backend.cache.models.CacheStatistics;
import com.github.passthrough.backend.config.properties.CacheProperties;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@link CacheService} manages the metadata, search result and stream caches.
 * Each cache has its own time-to-live and its own hit/miss counters.
 */
@Slf4j
@Service
public class CacheService {
    private static final long STATS_INTERVAL = 10 * 60 * 1000;

    private final Map<CacheType, Cache<String, Object>> caches = new EnumMap<>(CacheType.class);

    public CacheService(PassthroughProperties properties, Ticker ticker) {
        var ttl = properties.getCache();

        caches.put(CacheType.METADATA, createCache(ttl.getMetadata(), ticker));
        caches.put(CacheType.SEARCH_RESULTS, createCache(ttl.getSearchResults(), ticker));
        caches.put(CacheType.STREAMS, createCache(ttl.getStreams(), ticker));
        logConfiguration(ttl);
    }

    //region Methods

    /**
     * Get the value of the given key from the cache.
     * This counts as a hit or a miss for the given cache.
     *
     * @param type      The cache to look in.
     * @param key       The key of the value.
     * @param valueType The expected type of the cached value.
     * @param <T>       The type of the cached value.
     * @return Returns the cached value if present and not expired, else {@link Optional#empty()}.
     */
    public <T> Optional<T> get(CacheType type, String key, Class<T> valueType) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(valueType, "valueType cannot be null");
        var value = cache(type).getIfPresent(key);

        if (value != null) {
            log.debug("[CACHE HIT] {} for {}", type.getKey(), key);
        } else {
            log.trace("[CACHE MISS] {} for {}", type.getKey(), key);
        }

        return Optional.ofNullable(value)
                .filter(valueType::isInstance)
                .map(valueType::cast);
    }

    /**
     * Store the given value in the cache.
     *
     * @param type  The cache to store the value in.
     * @param key   The key of the value.
     * @param value The value to store.
     */
    public void set(CacheType type, String key, Object value) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        cache(type).put(key, value);
    }

    /**
     * Get the hit/miss counters of each cache.
     *
     * @return Returns the statistics per cache.
     */
    public Map<CacheType, CacheStatistics> statistics() {
        var result = new EnumMap<CacheType, CacheStatistics>(CacheType.class);
        caches.forEach((type, cache) -> {
            var stats = cache.stats();
            result.put(type, CacheStatistics.builder()
                    .hits(stats.hitCount())
                    .misses(stats.missCount())
                    .build());
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * Get the number of live entries of each cache.
     *
     * @return Returns the live entry count per cache.
     */
    public Map<CacheType, Long> sizes() {
        var result = new EnumMap<CacheType, Long>(CacheType.class);
        caches.forEach((type, cache) -> {
            // evict the expired entries before they're counted
            cache.cleanUp();
            result.put(type, cache.estimatedSize());
        });
        return Collections.unmodifiableMap(result);
    }

    @Scheduled(initialDelay = STATS_INTERVAL, fixedRate = STATS_INTERVAL)
    public void logStatistics() {
        var sizes = sizes();

        log.info("=== CACHE STATISTICS ===");
        statistics().forEach((type, stats) ->
                log.info("{} cache: {} hits, {} misses ({}% hit rate), {} entries",
                        type.getKey(), stats.getHits(), stats.getMisses(), String.format("%.1f", stats.getHitRate()), sizes.get(type)));
    }

    //endregion

    //region Functions

    private Cache<String, Object> cache(CacheType type) {
        return caches.get(type);
    }

    private void logConfiguration(CacheProperties ttl) {
        log.info("Cache configuration: metadata {}, torrent search {}, streams {}",
                ttl.getMetadata(), ttl.getSearchResults(), ttl.getStreams());
    }

    private static Cache<String, Object> createCache(Duration ttl, Ticker ticker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    //endregion
}
