package com.github.passthrough.backend.stream;

import com.github.passthrough.backend.stream.models.FailureReason;
import lombok.Getter;

/**
 * Stops the resolution of a torrent which the debrid provider accepted but which can't be played.
 */
@Getter
class ResolutionException extends Exception {
    private final FailureReason reason;

    ResolutionException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
