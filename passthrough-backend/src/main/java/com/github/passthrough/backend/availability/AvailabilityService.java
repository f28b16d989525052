package com.github.passthrough.backend.availability;

import com.github.passthrough.backend.debrid.DebridService;
import com.github.passthrough.backend.torrent.models.TorrentCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Prioritizes the candidates which are already cached on the debrid provider, as those start instantly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {
    private final DebridService debridService;

    /**
     * Reorder the given candidates so the instantly available ones come first.
     * The order within the cached and non-cached group is preserved.
     * The original order is returned when the availability couldn't be checked.
     *
     * @param candidates The candidates to prioritize.
     * @return Returns the reordered candidates.
     */
    public List<TorrentCandidate> prioritize(List<TorrentCandidate> candidates) {
        Objects.requireNonNull(candidates, "candidates cannot be null");
        var infoHashes = candidates.stream()
                .map(TorrentCandidate::getInfoHash)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());

        if (infoHashes.isEmpty()) {
            return candidates;
        }

        try {
            log.debug("Checking instant availability for {} torrents", infoHashes.size());
            var cachedHashes = debridService.getCachedInfoHashes(infoHashes);
            var cached = new ArrayList<TorrentCandidate>();
            var nonCached = new ArrayList<TorrentCandidate>();

            for (var candidate : candidates) {
                if (candidate.getInfoHash() != null && cachedHashes.contains(candidate.getInfoHash().toLowerCase())) {
                    cached.add(candidate);
                } else {
                    nonCached.add(candidate);
                }
            }

            log.debug("Found {} cached torrents, {} non-cached", cached.size(), nonCached.size());
            cached.addAll(nonCached);
            return cached;
        } catch (RuntimeException ex) {
            log.warn("Instant availability check failed, using original order, {}", ex.getMessage());
            return candidates;
        }
    }
}
