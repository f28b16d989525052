package com.github.passthrough.backend.media.providers;

import com.github.passthrough.backend.media.MediaType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.function.Function;

/**
 * Abstract implementation of a JSON provider API which serves resources as {@code /{resource}/{type}/{id}.json}.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractProviderService {
    protected final RestTemplate restTemplate;

    protected URI getUriFor(URI baseUrl, String resource, MediaType type, String id) {
        log.trace("Creating uri for base \"{}\", resource \"{}\", type \"{}\" and id \"{}\"", baseUrl, resource, type, id);
        return UriComponentsBuilder.fromUri(baseUrl)
                .path("/{resource}/{type}/{id}.json")
                .build(resource, type.getKey(), id);
    }

    /**
     * Invoke the given action against the provider.
     *
     * @param uri    The uri which is being requested.
     * @param action The action to execute.
     * @param <R>    The outcome/result of the action that is being executed.
     * @return Returns the result of the action.
     * @throws ProviderException Is thrown when the provider couldn't be reached or returned an invalid response.
     */
    protected <R> R invoke(URI uri, Function<URI, R> action) {
        try {
            return action.apply(uri);
        } catch (RestClientException ex) {
            throw handleException(uri, ex);
        }
    }

    private static ProviderException handleException(URI uri, RestClientException ex) {
        if (ex.getCause() instanceof HttpMessageNotReadableException) {
            return new ProviderParsingException(uri, "Failed to parse API response, " + ex.getMessage(), ex);
        }

        return new ProviderException(uri, "Provider request failed, " + ex.getMessage(), ex);
    }
}
