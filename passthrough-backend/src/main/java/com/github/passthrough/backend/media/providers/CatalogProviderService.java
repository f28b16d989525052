package com.github.passthrough.backend.media.providers;

import com.github.passthrough.backend.cache.CacheService;
import com.github.passthrough.backend.cache.CacheType;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.backend.media.ContentIds;
import com.github.passthrough.backend.media.MediaType;
import com.github.passthrough.backend.media.providers.models.Metadata;
import com.github.passthrough.backend.media.providers.models.MetadataResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the canonical title metadata of a content id through the catalog service.
 * All episodes of a series share the metadata of the series.
 */
@Slf4j
@Service
public class CatalogProviderService extends AbstractProviderService {
    private static final String RESOURCE = "meta";

    private final CacheService cacheService;
    private final URI baseUrl;

    public CatalogProviderService(@Qualifier("catalogRestTemplate") RestTemplate restTemplate,
                                  CacheService cacheService,
                                  PassthroughProperties properties) {
        super(restTemplate);
        this.cacheService = cacheService;
        this.baseUrl = properties.getCatalog().getUrl();
    }

    /**
     * Retrieve the metadata of the given content.
     *
     * @param type      The media type of the content.
     * @param contentId The content id, series episode ids are reduced to their base id.
     * @return Returns the metadata, or {@link Optional#empty()} when the title couldn't be found.
     */
    public Optional<Metadata> getMetadata(MediaType type, String contentId) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(contentId, "contentId cannot be null");
        var baseId = ContentIds.baseId(contentId);
        var cacheKey = "meta_" + type.getKey() + "_" + baseId;
        var cached = cacheService.get(CacheType.METADATA, cacheKey, Metadata.class);

        if (cached.isPresent()) {
            return cached;
        }

        var uri = getUriFor(baseUrl, RESOURCE, type, baseId);
        try {
            log.debug("Fetching metadata from {}", uri);
            var response = invoke(uri, e -> restTemplate.getForEntity(e, MetadataResponse.class));
            var metadata = Optional.ofNullable(response.getBody())
                    .map(MetadataResponse::getMeta);

            metadata.ifPresent(e -> {
                cacheService.set(CacheType.METADATA, cacheKey, e);
                log.debug("[CACHE MISS] Fetched and cached metadata for {}", contentId);
            });

            return metadata;
        } catch (ProviderException ex) {
            log.warn("Catalog metadata retrieval failed for {}, {}", contentId, ex.getMessage());
            return Optional.empty();
        }
    }
}
