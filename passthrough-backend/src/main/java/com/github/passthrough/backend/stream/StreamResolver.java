package com.github.passthrough.backend.stream;

import com.github.passthrough.backend.cache.CacheService;
import com.github.passthrough.backend.cache.CacheType;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.backend.config.properties.PollingProperties;
import com.github.passthrough.backend.debrid.DebridException;
import com.github.passthrough.backend.debrid.DebridService;
import com.github.passthrough.backend.debrid.models.DebridTorrentInfo;
import com.github.passthrough.backend.media.episodes.EpisodeMatcher;
import com.github.passthrough.backend.media.episodes.MatchingFile;
import com.github.passthrough.backend.media.episodes.SeasonEpisode;
import com.github.passthrough.backend.stream.models.FailureReason;
import com.github.passthrough.backend.stream.models.ResolutionOutcome;
import com.github.passthrough.backend.stream.models.StreamResult;
import com.github.passthrough.backend.torrent.models.TorrentCandidate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves a single torrent candidate into a direct stream url through the debrid provider.
 * The resolution adds the magnet, selects the file(s), polls until the torrent is downloaded and unrestricts the link.
 * Failures never escape the resolver, they're reported through the {@link ResolutionOutcome}.
 */
@Slf4j
@Service
public class StreamResolver {
    static final String MAGNET_PREFIX = "magnet:?xt=urn:btih:";
    static final String TITLE_PREFIX = "RD: ";
    static final String DEFAULT_TITLE = "Stream";
    private static final Pattern INFO_HASH_PATTERN = Pattern.compile("urn:btih:([a-zA-Z0-9]+)");
    private static final int DEFAULT_FILE_INDEX = 0;

    private final DebridService debridService;
    private final CacheService cacheService;
    private final PollingProperties polling;
    private final Sleeper sleeper;

    public StreamResolver(DebridService debridService, CacheService cacheService, PassthroughProperties properties, Sleeper sleeper) {
        this.debridService = debridService;
        this.cacheService = cacheService;
        this.polling = properties.getResolution().getPolling();
        this.sleeper = sleeper;
    }

    //region Methods

    /**
     * Resolve the stream of the given candidate.
     *
     * @param candidate     The torrent candidate to resolve.
     * @param seasonEpisode The requested episode, or null for movies.
     * @return Returns the outcome of the resolution.
     */
    public ResolutionOutcome resolve(TorrentCandidate candidate, SeasonEpisode seasonEpisode) {
        Objects.requireNonNull(candidate, "candidate cannot be null");
        var magnetLink = Optional.ofNullable(candidate.getMagnetLink())
                .filter(StringUtils::isNotBlank)
                .orElseGet(() -> MAGNET_PREFIX + candidate.getInfoHash());
        var infoHash = extractInfoHash(magnetLink);
        var cacheKey = cacheKey(infoHash, seasonEpisode);

        if (infoHash != null) {
            var cached = cacheService.get(CacheType.STREAMS, cacheKey, StreamResult.class);
            if (cached.isPresent()) {
                return ResolutionOutcome.resolved(cached.get());
            }
        }

        try {
            var stream = resolveWithProvider(magnetLink, seasonEpisode);

            if (infoHash != null) {
                cacheService.set(CacheType.STREAMS, cacheKey, stream);
            }

            log.debug("Resolved stream {} for {}", stream.getTitle(), infoHash);
            return ResolutionOutcome.resolved(stream);
        } catch (ResolutionException ex) {
            return ResolutionOutcome.failed(ex.getReason(), ex.getMessage());
        } catch (RestClientException | DebridException ex) {
            return ResolutionOutcome.failed(FailureReason.PROVIDER_ERROR, ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ResolutionOutcome.failed(FailureReason.INTERRUPTED, "Resolution of " + infoHash + " has been interrupted");
        } catch (RuntimeException ex) {
            return ResolutionOutcome.failed(FailureReason.UNEXPECTED, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    /**
     * Extract the info hash from the given magnet link.
     *
     * @param magnetLink The magnet link.
     * @return Returns the lower-cased info hash, or null when the link contains none.
     */
    public static String extractInfoHash(String magnetLink) {
        if (StringUtils.isEmpty(magnetLink)) {
            return null;
        }

        var matcher = INFO_HASH_PATTERN.matcher(magnetLink);
        return matcher.find() ? matcher.group(1).toLowerCase() : null;
    }

    //endregion

    //region Functions

    private StreamResult resolveWithProvider(String magnetLink, SeasonEpisode seasonEpisode) throws ResolutionException, InterruptedException {
        var torrentId = debridService.addMagnet(magnetLink).getId();
        var info = debridService.getTorrentInfo(torrentId);
        var matchingFile = selectFile(info, seasonEpisode);
        var fileIds = seasonEpisode != null && info.getFiles().size() > 1
                ? String.valueOf(matchingFile.getFileId())
                : DebridService.ALL_FILES;

        debridService.selectFiles(torrentId, fileIds);
        var readyInfo = awaitReady(torrentId);
        var links = readyInfo.getLinks();

        if (links.isEmpty()) {
            throw new ResolutionException(FailureReason.NO_LINKS, "Torrent " + torrentId + " has no links available");
        }

        var index = matchingFile.getIndex();
        var link = index >= 0 && index < links.size() ? links.get(index) : links.get(DEFAULT_FILE_INDEX);
        var unrestricted = debridService.unrestrictLink(link);

        return new StreamResult(unrestricted.getDownload(), TITLE_PREFIX + StringUtils.defaultIfBlank(readyInfo.getFilename(), DEFAULT_TITLE));
    }

    private static MatchingFile selectFile(DebridTorrentInfo info, SeasonEpisode seasonEpisode) {
        if (seasonEpisode == null || info.getFiles().isEmpty()) {
            return new MatchingFile(DEFAULT_FILE_INDEX, DEFAULT_FILE_INDEX, null);
        }

        var matchingFile = EpisodeMatcher.findMatchingFile(info.getFiles(), seasonEpisode);
        log.trace("Selected file {} (index {}) for {}", matchingFile.getFileId(), matchingFile.getIndex(), seasonEpisode.getTag());
        return matchingFile;
    }

    private DebridTorrentInfo awaitReady(String torrentId) throws ResolutionException, InterruptedException {
        var info = debridService.getTorrentInfo(torrentId);
        var attempts = 0;

        while (!info.isReady() && attempts < polling.getMaxAttempts()) {
            sleeper.sleep(polling.intervalFor(attempts));
            info = debridService.getTorrentInfo(torrentId);
            attempts++;
        }

        if (!info.isReady()) {
            throw new ResolutionException(FailureReason.NOT_READY,
                    "Torrent " + torrentId + " not ready after " + attempts + " attempts (status: " + info.getStatus() + ")");
        }

        return info;
    }

    private static String cacheKey(String infoHash, SeasonEpisode seasonEpisode) {
        var suffix = seasonEpisode != null ? seasonEpisode.getTag() : String.valueOf(DEFAULT_FILE_INDEX);
        return "stream_" + infoHash + "_" + suffix;
    }

    //endregion
}
