package com.github.passthrough.backend.stream.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of resolving a single candidate, either a stream or the reason it failed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolutionOutcome {
    StreamResult stream;
    FailureReason reason;
    String message;

    public static ResolutionOutcome resolved(StreamResult stream) {
        Objects.requireNonNull(stream, "stream cannot be null");
        return new ResolutionOutcome(stream, null, null);
    }

    public static ResolutionOutcome failed(FailureReason reason, String message) {
        Objects.requireNonNull(reason, "reason cannot be null");
        return new ResolutionOutcome(null, reason, message);
    }

    public boolean isResolved() {
        return stream != null;
    }

    public Optional<StreamResult> getStream() {
        return Optional.ofNullable(stream);
    }

    public Optional<FailureReason> getReason() {
        return Optional.ofNullable(reason);
    }
}
