package com.github.passthrough.backend.config.properties;

import lombok.Data;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

@Data
public class PollingProperties {
    /**
     * The max. number of torrent info polls before a torrent is considered not ready.
     */
    @Min(0)
    private int maxAttempts = 10;
    /**
     * The number of polls which use the initial interval.
     */
    @Min(0)
    private int fastAttempts = 2;
    /**
     * The wait time of the first polls, cached torrents are most of the time ready immediately.
     */
    @NotNull
    private Duration initialInterval = Duration.ofMillis(500);
    /**
     * The wait time of the remaining polls.
     */
    @NotNull
    private Duration interval = Duration.ofSeconds(1);

    public Duration intervalFor(int attempt) {
        return attempt < fastAttempts ? initialInterval : interval;
    }
}
