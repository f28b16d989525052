package com.github.passthrough.backend.media.providers;

import java.net.URI;

/**
 * Indicates that the occurred exception was caused while parsing the provider response.
 * This most of the time indicates an invalid response from the API.
 */
public class ProviderParsingException extends ProviderException {
    public ProviderParsingException(URI uri, String message, Throwable cause) {
        super(uri, message, cause);
    }
}
