package com.github.passthrough.backend.media.providers;

import lombok.Getter;

import java.net.URI;

/**
 * Exception indicating that an external provider couldn't be reached or returned an error.
 */
@Getter
public class ProviderException extends RuntimeException {
    private final URI uri;

    public ProviderException(URI uri, String message) {
        super(message);
        this.uri = uri;
    }

    public ProviderException(URI uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }
}
