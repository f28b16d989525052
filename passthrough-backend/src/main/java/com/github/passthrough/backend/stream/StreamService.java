package com.github.passthrough.backend.stream;

import com.github.passthrough.backend.availability.AvailabilityService;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.backend.config.properties.ResolutionProperties;
import com.github.passthrough.backend.media.MediaType;
import com.github.passthrough.backend.media.episodes.EpisodeMatcher;
import com.github.passthrough.backend.media.episodes.ScoredCandidate;
import com.github.passthrough.backend.media.episodes.SeasonEpisode;
import com.github.passthrough.backend.media.providers.CatalogProviderService;
import com.github.passthrough.backend.stream.models.BatchSettings;
import com.github.passthrough.backend.stream.models.BehaviorHints;
import com.github.passthrough.backend.stream.models.FailureReason;
import com.github.passthrough.backend.stream.models.PlayableStream;
import com.github.passthrough.backend.stream.models.ResolutionOutcome;
import com.github.passthrough.backend.stream.models.StreamResponse;
import com.github.passthrough.backend.stream.models.StreamResult;
import com.github.passthrough.backend.torrent.TorrentSearchService;
import com.github.passthrough.backend.torrent.models.TorrentCandidate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The entry point of the stream resolution pipeline.
 * A request flows through the metadata lookup, the torrent search, the episode filter, the availability prioritization
 * and finally the batched resolution through the debrid provider.
 */
@Slf4j
@Service
public class StreamService {
    static final String NAME_PREFIX = "RD+ ";
    static final String BINGE_GROUP = "real-debrid";

    private final CatalogProviderService catalogProviderService;
    private final TorrentSearchService torrentSearchService;
    private final AvailabilityService availabilityService;
    private final StreamResolver streamResolver;
    private final BatchScheduler batchScheduler;
    private final ResolutionProperties resolution;
    private final Clock clock;

    public StreamService(CatalogProviderService catalogProviderService,
                         TorrentSearchService torrentSearchService,
                         AvailabilityService availabilityService,
                         StreamResolver streamResolver,
                         BatchScheduler batchScheduler,
                         PassthroughProperties properties,
                         Clock clock) {
        this.catalogProviderService = catalogProviderService;
        this.torrentSearchService = torrentSearchService;
        this.availabilityService = availabilityService;
        this.streamResolver = streamResolver;
        this.batchScheduler = batchScheduler;
        this.resolution = properties.getResolution();
        this.clock = clock;
    }

    //region Methods

    /**
     * Resolve the playable streams of the given content.
     * This method never throws, every failure results in fewer or no streams.
     *
     * @param type      The media type key, {@code movie} or {@code series}.
     * @param contentId The content id, {@code <baseId>:<season>:<episode>} for series episodes.
     * @return Returns the resolved streams, possibly empty.
     */
    public StreamResponse resolveStreams(String type, String contentId) {
        var mediaType = MediaType.fromKey(type);

        if (mediaType.isEmpty() || StringUtils.isBlank(contentId)) {
            log.warn("Unable to resolve streams for type \"{}\" and id \"{}\"", type, contentId);
            return StreamResponse.empty();
        }

        try {
            return doResolveStreams(mediaType.get(), contentId);
        } catch (RuntimeException ex) {
            log.error("Stream resolution of {} failed, {}", contentId, ex.getMessage(), ex);
            return StreamResponse.empty();
        }
    }

    //endregion

    //region Functions

    private StreamResponse doResolveStreams(MediaType type, String contentId) {
        var startTime = clock.millis();
        var seasonEpisode = type == MediaType.SERIES ? EpisodeMatcher.extractSeasonEpisode(contentId) : null;
        log.info("Resolving streams for {} {}{}", type.getKey(), contentId,
                seasonEpisode != null ? " (" + seasonEpisode.getTag() + ")" : "");

        var metadata = catalogProviderService.getMetadata(type, contentId);
        if (metadata.isEmpty()) {
            log.info("No metadata found for {}", contentId);
            return StreamResponse.empty();
        }

        var candidates = torrentSearchService.search(contentId, type);
        if (candidates.isEmpty()) {
            log.info("No torrents found for {} ({})", metadata.get().getName(), contentId);
            return StreamResponse.empty();
        }

        var filtered = seasonEpisode != null ? filterByEpisode(candidates, seasonEpisode) : candidates;
        var checked = limit(filtered, resolution.getAvailabilityCheckLimit());
        var prioritized = limit(availabilityService.prioritize(checked), resolution.getTorrentLimit());
        var settings = BatchSettings.builder()
                .maxConcurrency(resolution.getMaxConcurrency())
                .targetResults(resolution.getMaxStreams())
                .deadline(Optional.ofNullable(resolution.getRequestTimeout())
                        .map(e -> clock.instant().plus(e))
                        .orElse(null))
                .build();

        log.debug("Processing {} of {} torrents for {}", prioritized.size(), candidates.size(), contentId);
        var result = batchScheduler.schedule(prioritized, e -> resolve(e, seasonEpisode), settings);

        log.info("Resolved {} streams for {} ({} torrents attempted) in {}ms",
                result.getResults().size(), contentId, result.getAttempted(), clock.millis() - startTime);
        return new StreamResponse(result.getResults());
    }

    private Optional<PlayableStream> resolve(TorrentCandidate candidate, SeasonEpisode seasonEpisode) {
        log.debug("Processing torrent {}", StringUtils.abbreviate(candidate.getTitle(), 60));
        var outcome = streamResolver.resolve(candidate, seasonEpisode);

        if (!outcome.isResolved()) {
            logFailure(candidate, outcome);
        }

        return outcome.getStream()
                .map(e -> toPlayableStream(candidate, e));
    }

    private List<TorrentCandidate> filterByEpisode(List<TorrentCandidate> candidates, SeasonEpisode seasonEpisode) {
        var scored = candidates.stream()
                .map(e -> ScoredCandidate.score(e, seasonEpisode))
                .collect(Collectors.toList());
        var matching = scored.stream()
                .filter(ScoredCandidate::isMatches)
                .sorted(Comparator.comparingInt(ScoredCandidate::getMatchScore).reversed())
                .map(ScoredCandidate::getCandidate)
                .collect(Collectors.toList());
        var fallback = scored.stream()
                .filter(e -> !e.isMatches())
                .limit(resolution.getFallbackCandidates())
                .map(ScoredCandidate::getCandidate)
                .collect(Collectors.toList());
        var result = new ArrayList<TorrentCandidate>(matching);

        log.debug("Found {} torrents matching {}, keeping {} fallback torrents", matching.size(), seasonEpisode.getTag(), fallback.size());
        result.addAll(fallback);
        return result;
    }

    private static PlayableStream toPlayableStream(TorrentCandidate candidate, StreamResult stream) {
        return PlayableStream.builder()
                .name((NAME_PREFIX + StringUtils.defaultString(candidate.getQuality())).trim())
                .title(candidate.getTitle())
                .url(stream.getUrl())
                .behaviorHints(BehaviorHints.builder()
                        .bingeGroup(BINGE_GROUP)
                        .notWebReady(false)
                        .build())
                .build();
    }

    private static void logFailure(TorrentCandidate candidate, ResolutionOutcome outcome) {
        var reason = outcome.getReason().orElse(FailureReason.UNEXPECTED);

        if (reason == FailureReason.UNEXPECTED) {
            log.error("Failed to process torrent {}, {}", candidate.getInfoHash(), outcome.getMessage());
        } else {
            log.warn("Failed to process torrent {} ({}), {}", candidate.getInfoHash(), reason, outcome.getMessage());
        }
    }

    private static <T> List<T> limit(List<T> items, int limit) {
        return items.size() > limit ? items.subList(0, limit) : items;
    }

    //endregion
}
