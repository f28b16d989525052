package com.github.passthrough.backend.cache;

import com.github.passthrough.backend.config.properties.PassthroughProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CacheServiceTest {
    private final AtomicLong time = new AtomicLong();

    private PassthroughProperties properties;
    private CacheService service;

    @BeforeEach
    void setUp() {
        properties = new PassthroughProperties();
        service = new CacheService(properties, time::get);
    }

    @Test
    void testGet_whenValueHasBeenSet_shouldReturnValueAndCountHit() {
        var key = "meta_movie_tt0111161";
        var value = "lorem";
        service.set(CacheType.METADATA, key, value);

        var result = service.get(CacheType.METADATA, key, String.class);

        assertTrue(result.isPresent(), "Expected the cached value to have been returned");
        assertEquals(value, result.get());
        assertEquals(1, service.statistics().get(CacheType.METADATA).getHits());
        assertEquals(0, service.statistics().get(CacheType.METADATA).getMisses());
    }

    @Test
    void testGet_whenKeyIsAbsent_shouldReturnEmptyAndCountMiss() {
        var result = service.get(CacheType.STREAMS, "stream_unknown_S1E1", String.class);

        assertTrue(result.isEmpty(), "Expected no value to have been returned");
        assertEquals(0, service.statistics().get(CacheType.STREAMS).getHits());
        assertEquals(1, service.statistics().get(CacheType.STREAMS).getMisses());
    }

    @Test
    void testGet_whenTtlHasPassed_shouldReturnEmpty() {
        var key = "stream_abc_0";
        service.set(CacheType.STREAMS, key, "ipsum");
        time.addAndGet(properties.getCache().getStreams().plusNanos(1).toNanos());

        var result = service.get(CacheType.STREAMS, key, String.class);

        assertTrue(result.isEmpty(), "Expected the expired value to not have been returned");
    }

    @Test
    void testGet_whenTtlHasNotPassed_shouldReturnValue() {
        var key = "torrents_movie_tt0111161";
        service.set(CacheType.SEARCH_RESULTS, key, "dolor");
        time.addAndGet(properties.getCache().getSearchResults().minus(Duration.ofSeconds(1)).toNanos());

        var result = service.get(CacheType.SEARCH_RESULTS, key, String.class);

        assertTrue(result.isPresent(), "Expected the value to still be cached");
    }

    @Test
    void testGet_whenValueIsSetInOtherCache_shouldReturnEmpty() {
        var key = "lorem";
        service.set(CacheType.METADATA, key, "ipsum");

        var result = service.get(CacheType.STREAMS, key, String.class);

        assertTrue(result.isEmpty(), "Expected the caches to be independent");
    }

    @Test
    void testSizes_whenEntriesExpired_shouldOnlyCountLiveEntries() {
        service.set(CacheType.STREAMS, "stream_a_0", "a");
        time.addAndGet(Duration.ofMinutes(20).toNanos());
        service.set(CacheType.STREAMS, "stream_b_0", "b");
        service.set(CacheType.METADATA, "meta_movie_tt1", "c");
        time.addAndGet(Duration.ofMinutes(15).toNanos());

        var result = service.sizes();

        assertEquals(1L, result.get(CacheType.STREAMS));
        assertEquals(1L, result.get(CacheType.METADATA));
        assertEquals(0L, result.get(CacheType.SEARCH_RESULTS));
    }

    @Test
    void testStatistics_whenHitsAndMisses_shouldReturnHitRate() {
        service.set(CacheType.METADATA, "lorem", "ipsum");
        service.get(CacheType.METADATA, "lorem", String.class);
        service.get(CacheType.METADATA, "lorem", String.class);
        service.get(CacheType.METADATA, "lorem", String.class);
        service.get(CacheType.METADATA, "dolor", String.class);

        var result = service.statistics().get(CacheType.METADATA);

        assertEquals(4, result.getRequests());
        assertEquals(75.0, result.getHitRate(), 0.001);
    }

    @Test
    void testGet_whenValueHasOtherType_shouldReturnEmpty() {
        var key = "meta_movie_tt0111161";
        service.set(CacheType.METADATA, key, 42);

        var result = service.get(CacheType.METADATA, key, String.class);

        assertTrue(result.isEmpty(), "Expected a value of another type to not have been returned");
    }

    @Test
    void testGetAndSet_whenInvokedConcurrentlyOnSameKey_shouldAlwaysReturnStoredValue() throws Exception {
        var key = "stream_abc_S1E1";
        var executor = Executors.newFixedThreadPool(8);
        var tasks = new ArrayList<Callable<Boolean>>();
        for (var i = 0; i < 8; i++) {
            var value = "value" + i;
            tasks.add(() -> {
                for (var j = 0; j < 500; j++) {
                    service.set(CacheType.STREAMS, key, value);
                    var result = service.get(CacheType.STREAMS, key, String.class);
                    if (result.isEmpty() || !result.get().startsWith("value")) {
                        return false;
                    }
                }
                return true;
            });
        }

        try {
            for (Future<Boolean> future : executor.invokeAll(tasks, 10, TimeUnit.SECONDS)) {
                assertTrue(future.get(), "Expected every read to return a stored value");
            }
        } finally {
            executor.shutdownNow();
        }

        var stats = service.statistics().get(CacheType.STREAMS);
        assertEquals(4000, stats.getHits());
        assertEquals(0, stats.getMisses());
        assertEquals(1L, service.sizes().get(CacheType.STREAMS));
    }
}
