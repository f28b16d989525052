package com.github.passthrough.backend.stream.models;

public enum FailureReason {
    /**
     * The torrent didn't become ready within the polling attempts.
     */
    NOT_READY,
    /**
     * The torrent became ready but has no links.
     */
    NO_LINKS,
    /**
     * The debrid provider rejected a call or couldn't be reached.
     */
    PROVIDER_ERROR,
    INTERRUPTED,
    UNEXPECTED
}
