package com.github.passthrough.backend.config.properties;

import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

@Data
public class ResolutionProperties {
    /**
     * The max. number of candidates which are resolved through the debrid provider.
     */
    @Min(1)
    @Max(50)
    private int torrentLimit = 15;
    /**
     * The max. number of candidates which are checked for instant availability.
     */
    @Min(5)
    @Max(50)
    private int availabilityCheckLimit = 15;
    /**
     * The number of resolved streams after which no new batch is started.
     */
    @Min(1)
    @Max(20)
    private int maxStreams = 5;
    /**
     * The max. number of candidates resolved at the same time.
     */
    @Min(1)
    @Max(10)
    private int maxConcurrency = 3;
    /**
     * The number of non-matching candidates kept behind the episode matches.
     */
    @Min(0)
    private int fallbackCandidates = 3;
    /**
     * The overall deadline of a stream request.
     * Batches are awaited without deadline when absent.
     */
    private Duration requestTimeout;

    @Valid
    @NotNull
    private PollingProperties polling = new PollingProperties();
}
