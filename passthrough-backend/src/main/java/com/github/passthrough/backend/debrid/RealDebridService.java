package com.github.passthrough.backend.debrid;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.backend.debrid.models.AddMagnetResponse;
import com.github.passthrough.backend.debrid.models.DebridTorrentInfo;
import com.github.passthrough.backend.debrid.models.UnrestrictResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link DebridService} implementation of the Real-Debrid REST API.
 */
@Slf4j
@Service
public class RealDebridService implements DebridService {
    private final RestTemplate restTemplate;
    private final URI baseUrl;

    public RealDebridService(@Qualifier("debridRestTemplate") RestTemplate restTemplate, PassthroughProperties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = properties.getDebrid().getUrl();
    }

    //region DebridService

    @Override
    public AddMagnetResponse addMagnet(String magnetLink) {
        Objects.requireNonNull(magnetLink, "magnetLink cannot be null");
        var uri = uriFor("/torrents/addMagnet");

        log.trace("Adding magnet to the debrid provider");
        var response = restTemplate.postForEntity(uri, form("magnet", magnetLink), AddMagnetResponse.class);

        return Optional.ofNullable(response.getBody())
                .filter(e -> StringUtils.isNotEmpty(e.getId()))
                .orElseThrow(() -> new DebridException("Debrid provider didn't return a torrent id"));
    }

    @Override
    public DebridTorrentInfo getTorrentInfo(String torrentId) {
        Objects.requireNonNull(torrentId, "torrentId cannot be null");
        var uri = uriFor("/torrents/info/{id}", torrentId);

        log.trace("Retrieving debrid torrent info of {}", torrentId);
        var response = restTemplate.getForEntity(uri, DebridTorrentInfo.class);

        return Optional.ofNullable(response.getBody())
                .orElseThrow(() -> new DebridException("No torrent info available for " + torrentId));
    }

    @Override
    public void selectFiles(String torrentId, String fileIds) {
        Objects.requireNonNull(torrentId, "torrentId cannot be null");
        var files = StringUtils.defaultIfBlank(fileIds, ALL_FILES);
        var uri = uriFor("/torrents/selectFiles/{id}", torrentId);

        log.trace("Selecting files \"{}\" of debrid torrent {}", files, torrentId);
        restTemplate.postForEntity(uri, form("files", files), Void.class);
    }

    @Override
    public UnrestrictResponse unrestrictLink(String link) {
        Objects.requireNonNull(link, "link cannot be null");
        var uri = uriFor("/unrestrict/link");

        log.trace("Unrestricting debrid link {}", link);
        var response = restTemplate.postForEntity(uri, form("link", link), UnrestrictResponse.class);

        return Optional.ofNullable(response.getBody())
                .filter(e -> StringUtils.isNotEmpty(e.getDownload()))
                .orElseThrow(() -> new DebridException("Debrid provider didn't return a download link for " + link));
    }

    @Override
    public Set<String> getCachedInfoHashes(Collection<String> infoHashes) {
        Objects.requireNonNull(infoHashes, "infoHashes cannot be null");
        if (infoHashes.isEmpty()) {
            return Collections.emptySet();
        }

        var uri = UriComponentsBuilder.fromUri(baseUrl)
                .path("/torrents/instantAvailability")
                .pathSegment(infoHashes.toArray(new String[0]))
                .build()
                .toUri();
        log.trace("Checking instant availability of {} torrents", infoHashes.size());
        var response = restTemplate.getForEntity(uri, JsonNode.class);
        var body = response.getBody();
        var cachedHashes = new HashSet<String>();

        // a hash is cached when the provider returns a non-empty object for it
        // uncached hashes are returned as an empty object or an empty array
        if (body != null && body.isObject()) {
            body.fields().forEachRemaining(e -> {
                var value = e.getValue();
                if (value.isObject() && value.size() > 0) {
                    cachedHashes.add(e.getKey().toLowerCase());
                }
            });
        }

        return cachedHashes;
    }

    //endregion

    //region Functions

    private URI uriFor(String path, Object... variables) {
        return UriComponentsBuilder.fromUri(baseUrl)
                .path(path)
                .build(variables);
    }

    private static HttpEntity<MultiValueMap<String, String>> form(String key, String value) {
        var headers = new HttpHeaders();
        var body = new LinkedMultiValueMap<String, String>();

        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        body.add(key, value);

        return new HttpEntity<>(body, headers);
    }

    //endregion
}
