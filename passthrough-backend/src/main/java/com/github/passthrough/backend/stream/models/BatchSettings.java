package com.github.passthrough.backend.stream.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

@Value
@Builder
public class BatchSettings {
    /**
     * The max. number of jobs running at the same time, also the size of a batch.
     */
    int maxConcurrency;
    /**
     * The number of results after which no new batch is started.
     */
    int targetResults;
    /**
     * The moment after which no new batch is started and running batches are no longer awaited.
     */
    Instant deadline;

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }
}
