package com.github.passthrough.backend.config.properties;

import lombok.Data;

import javax.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;

@Data
public class ProviderProperties {
    /**
     * The base url of the provider API.
     */
    @NotNull
    private URI url;
    /**
     * The connect and read timeout of a provider call.
     * No timeout is applied when absent.
     */
    private Duration timeout;
    /**
     * The user agent under which is communicated with the provider.
     */
    private String userAgent;

    static ProviderProperties of(String url, Duration timeout, String userAgent) {
        var properties = new ProviderProperties();
        properties.setUrl(URI.create(url));
        properties.setTimeout(timeout);
        properties.setUserAgent(userAgent);
        return properties;
    }
}
