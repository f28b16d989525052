package com.github.passthrough.backend.config.properties;

import lombok.Data;

import javax.validation.constraints.NotNull;
import java.time.Duration;

@Data
public class CacheProperties {
    /**
     * The time-to-live of the title metadata.
     */
    @NotNull
    private Duration metadata = Duration.ofHours(24);
    /**
     * The time-to-live of the torrent search results.
     */
    @NotNull
    private Duration searchResults = Duration.ofHours(6);
    /**
     * The time-to-live of the resolved streams.
     */
    @NotNull
    private Duration streams = Duration.ofMinutes(30);
}
