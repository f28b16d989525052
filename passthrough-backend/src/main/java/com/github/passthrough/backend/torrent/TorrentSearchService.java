package com.github.passthrough.backend.torrent;

import com.github.passthrough.backend.cache.CacheService;
import com.github.passthrough.backend.cache.CacheType;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.backend.media.MediaType;
import com.github.passthrough.backend.media.parsers.SizeParser;
import com.github.passthrough.backend.media.providers.AbstractProviderService;
import com.github.passthrough.backend.media.providers.ProviderException;
import com.github.passthrough.backend.torrent.models.AggregatorResponse;
import com.github.passthrough.backend.torrent.models.AggregatorStream;
import com.github.passthrough.backend.torrent.models.TorrentCandidate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Searches the release aggregator for torrent candidates of a content id.
 * Search results are cached per episode as the candidates differ between episodes.
 */
@Slf4j
@Service
public class TorrentSearchService extends AbstractProviderService {
    static final String MAGNET_PREFIX = "magnet:?xt=urn:btih:";
    static final String UNKNOWN = "unknown";
    private static final String RESOURCE = "stream";

    private final CacheService cacheService;
    private final URI baseUrl;

    public TorrentSearchService(@Qualifier("aggregatorRestTemplate") RestTemplate restTemplate,
                                CacheService cacheService,
                                PassthroughProperties properties) {
        super(restTemplate);
        this.cacheService = cacheService;
        this.baseUrl = properties.getAggregator().getUrl();
    }

    /**
     * Search the torrent candidates of the given content.
     *
     * @param contentId The content id, including the season and episode for series.
     * @param type      The media type of the content.
     * @return Returns the candidates, or an empty list when the aggregator failed or found nothing.
     */
    public List<TorrentCandidate> search(String contentId, MediaType type) {
        Objects.requireNonNull(contentId, "contentId cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        var cacheKey = "torrents_" + type.getKey() + "_" + contentId;
        var cached = cacheService.get(CacheType.SEARCH_RESULTS, cacheKey, TorrentCandidate[].class);

        if (cached.isPresent()) {
            return List.of(cached.get());
        }

        var uri = getUriFor(baseUrl, RESOURCE, type, contentId);
        try {
            log.debug("Searching torrents at {}", uri);
            var response = invoke(uri, e -> restTemplate.getForEntity(e, AggregatorResponse.class));
            var candidates = Optional.ofNullable(response.getBody())
                    .map(AggregatorResponse::getStreams)
                    .map(TorrentSearchService::toCandidates)
                    .orElse(Collections.emptyList());

            // empty results are not cached so a failing aggregator is retried on the next request
            if (!candidates.isEmpty()) {
                cacheService.set(CacheType.SEARCH_RESULTS, cacheKey, candidates.toArray(new TorrentCandidate[0]));
                log.debug("[CACHE MISS] Fetched and cached {} torrents for {}", candidates.size(), contentId);
            }

            return candidates;
        } catch (ProviderException ex) {
            log.warn("Torrent search failed for {}, {}", contentId, ex.getMessage());
            return Collections.emptyList();
        }
    }

    private static List<TorrentCandidate> toCandidates(List<AggregatorStream> streams) {
        var candidates = new LinkedHashMap<String, TorrentCandidate>();

        streams.stream()
                .filter(Objects::nonNull)
                .filter(e -> StringUtils.isNotBlank(e.getInfoHash()))
                .map(TorrentSearchService::toCandidate)
                .forEach(e -> candidates.putIfAbsent(e.getInfoHash(), e));

        return Collections.unmodifiableList(new ArrayList<>(candidates.values()));
    }

    private static TorrentCandidate toCandidate(AggregatorStream stream) {
        var infoHash = stream.getInfoHash().trim().toLowerCase();
        var title = StringUtils.firstNonBlank(stream.getTitle(), stream.getName(), infoHash);

        return TorrentCandidate.builder()
                .title(title)
                .infoHash(infoHash)
                .magnetLink(MAGNET_PREFIX + infoHash)
                .quality(StringUtils.defaultIfBlank(stream.getName(), UNKNOWN))
                .size(SizeParser.extractSize(stream.getTitle()).orElse(UNKNOWN))
                .build();
    }
}
