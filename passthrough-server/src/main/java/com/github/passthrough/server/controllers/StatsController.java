package com.github.passthrough.server.controllers;

import com.github.passthrough.backend.cache.CacheService;
import com.github.passthrough.backend.cache.CacheType;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.server.config.properties.AddonProperties;
import com.github.passthrough.server.controllers.models.StatsResponse;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
public class StatsController {
    private static final double BYTES_PER_MB = 1024 * 1024;

    private final CacheService cacheService;
    private final PassthroughProperties properties;
    private final AddonProperties addonProperties;
    private final Clock clock;
    private final Instant startTime;

    public StatsController(CacheService cacheService, PassthroughProperties properties, AddonProperties addonProperties, Clock clock) {
        this.cacheService = cacheService;
        this.properties = properties;
        this.addonProperties = addonProperties;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    @RequestMapping(value = "/stats", method = RequestMethod.GET)
    public StatsResponse stats() {
        return StatsResponse.builder()
                .addonStatus(StatsResponse.STATUS_ONLINE)
                .rdConnected(properties.getDebrid().isTokenConfigured())
                .cacheStats(byKey(cacheService.statistics()))
                .cacheSizes(byKey(cacheService.sizes()))
                .memoryUsage(memoryUsage())
                .version(addonProperties.getVersion())
                .uptime(Duration.between(startTime, clock.instant()).toMillis() / 1000.0)
                .torrentLimit(properties.getResolution().getTorrentLimit())
                .build();
    }

    private static <T> Map<String, T> byKey(Map<CacheType, T> values) {
        var result = new LinkedHashMap<String, T>();
        values.forEach((type, value) -> result.put(type.getKey(), value));
        return result;
    }

    private static String memoryUsage() {
        var runtime = Runtime.getRuntime();
        var used = runtime.totalMemory() - runtime.freeMemory();
        return String.format(Locale.ROOT, "%.2f MB", used / BYTES_PER_MB);
    }
}
