package com.github.passthrough.backend.stream.models;

import lombok.Value;

import java.util.List;

@Value
public class BatchResult<R> {
    /**
     * The results in candidate order, never more than the target.
     */
    List<R> results;
    /**
     * The number of items for which a job has been started.
     */
    int attempted;
}
