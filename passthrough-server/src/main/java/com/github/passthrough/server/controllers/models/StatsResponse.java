package com.github.passthrough.server.controllers.models;

import com.github.passthrough.backend.cache.models.CacheStatistics;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class StatsResponse {
    public static final String STATUS_ONLINE = "online";

    String addonStatus;
    /**
     * Indicates if a debrid API token has been configured, the token itself is not verified.
     */
    boolean rdConnected;
    Map<String, CacheStatistics> cacheStats;
    Map<String, Long> cacheSizes;
    /**
     * The used heap, e.g. {@code 42.17 MB}.
     */
    String memoryUsage;
    String version;
    /**
     * The uptime of the server in seconds.
     */
    double uptime;
    int torrentLimit;
}
