package com.github.passthrough.backend.stream;

import com.github.passthrough.backend.availability.AvailabilityService;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.backend.debrid.DebridService;
import com.github.passthrough.backend.media.MediaType;
import com.github.passthrough.backend.media.episodes.SeasonEpisode;
import com.github.passthrough.backend.media.providers.CatalogProviderService;
import com.github.passthrough.backend.media.providers.models.Metadata;
import com.github.passthrough.backend.stream.models.FailureReason;
import com.github.passthrough.backend.stream.models.PlayableStream;
import com.github.passthrough.backend.stream.models.ResolutionOutcome;
import com.github.passthrough.backend.stream.models.StreamResult;
import com.github.passthrough.backend.torrent.TorrentSearchService;
import com.github.passthrough.backend.torrent.models.TorrentCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StreamServiceTest {
    private static final String SERIES_ID = "tt0434665:6:3";
    private static final SeasonEpisode SEASON_EPISODE = new SeasonEpisode(6, 3);
    private static final Metadata METADATA = Metadata.builder()
            .id("tt0434665")
            .name("Bones")
            .year("2005-2017")
            .build();

    @Mock
    private CatalogProviderService catalogProviderService;
    @Mock
    private TorrentSearchService torrentSearchService;
    @Mock
    private DebridService debridService;
    @Mock
    private StreamResolver streamResolver;

    private PassthroughProperties properties;
    private StreamService service;

    @BeforeEach
    void setUp() {
        properties = new PassthroughProperties();
        createService();
    }

    @Test
    void testResolveStreams_whenCachedCandidateMatchesEpisode_shouldResolveItFirst() {
        var packOtherEpisode = candidate("aaaa", "Bones.S06E04.720p", "720p");
        var exactMatch = candidate("bbbb", "Bones.S06E03.720p.HDTV", "720p");
        var seasonPack = candidate("cccc", "Bones.Season.6.Complete", "1080p");
        var crossMatch = candidate("dddd", "Bones 6x03 1080p WEB", "1080p");
        var otherShow = candidate("eeee", "Other.Show.S02E05", "480p");
        when(catalogProviderService.getMetadata(MediaType.SERIES, SERIES_ID)).thenReturn(Optional.of(METADATA));
        when(torrentSearchService.search(SERIES_ID, MediaType.SERIES))
                .thenReturn(List.of(packOtherEpisode, exactMatch, seasonPack, crossMatch, otherShow));
        when(debridService.getCachedInfoHashes(anyCollection())).thenReturn(Set.of("dddd"));
        when(streamResolver.resolve(any(TorrentCandidate.class), eq(SEASON_EPISODE))).thenAnswer(invocation -> {
            TorrentCandidate candidate = invocation.getArgument(0);
            return candidate == crossMatch || candidate == packOtherEpisode
                    ? ResolutionOutcome.resolved(new StreamResult("https://download/" + candidate.getInfoHash(), "RD: " + candidate.getTitle()))
                    : ResolutionOutcome.failed(FailureReason.NOT_READY, "Torrent not ready");
        });

        var result = service.resolveStreams("series", SERIES_ID);

        verify(debridService).getCachedInfoHashes(List.of("bbbb", "dddd", "aaaa", "cccc", "eeee"));
        var urls = result.getStreams().stream()
                .map(PlayableStream::getUrl)
                .collect(Collectors.toList());
        assertEquals(List.of("https://download/dddd", "https://download/aaaa"), urls);
    }

    @Test
    void testResolveStreams_whenStreamIsResolved_shouldReturnPlayableStream() {
        var movie = candidate("ffff", "Movie.2020.1080p.BluRay", "Torrentio 1080p");
        when(catalogProviderService.getMetadata(MediaType.MOVIE, "tt0111161")).thenReturn(Optional.of(METADATA));
        when(torrentSearchService.search("tt0111161", MediaType.MOVIE)).thenReturn(List.of(movie));
        when(debridService.getCachedInfoHashes(anyCollection())).thenReturn(Collections.emptySet());
        when(streamResolver.resolve(movie, null)).thenReturn(ResolutionOutcome.resolved(new StreamResult("https://download/ffff", "RD: Movie.mkv")));

        var result = service.resolveStreams("movie", "tt0111161");

        assertEquals(1, result.getStreams().size());
        var stream = result.getStreams().get(0);
        assertEquals("RD+ Torrentio 1080p", stream.getName());
        assertEquals("Movie.2020.1080p.BluRay", stream.getTitle());
        assertEquals("https://download/ffff", stream.getUrl());
        assertEquals(StreamService.BINGE_GROUP, stream.getBehaviorHints().getBingeGroup());
        assertFalse(stream.getBehaviorHints().isNotWebReady());
    }

    @Test
    void testResolveStreams_whenAggregatorReturnsNoCandidates_shouldNotInvokeDebridProvider() {
        when(catalogProviderService.getMetadata(MediaType.SERIES, SERIES_ID)).thenReturn(Optional.of(METADATA));
        when(torrentSearchService.search(SERIES_ID, MediaType.SERIES)).thenReturn(Collections.emptyList());

        var result = service.resolveStreams("series", SERIES_ID);

        assertTrue(result.getStreams().isEmpty(), "Expected no streams");
        verifyNoInteractions(debridService, streamResolver);
    }

    @Test
    void testResolveStreams_whenMetadataIsNotFound_shouldNotSearchTorrents() {
        when(catalogProviderService.getMetadata(MediaType.MOVIE, "tt0000000")).thenReturn(Optional.empty());

        var result = service.resolveStreams("movie", "tt0000000");

        assertTrue(result.getStreams().isEmpty(), "Expected no streams");
        verifyNoInteractions(torrentSearchService, debridService, streamResolver);
    }

    @Test
    void testResolveStreams_whenTypeIsUnknown_shouldReturnEmptyStreams() {
        var result = service.resolveStreams("channel", "tt0111161");

        assertTrue(result.getStreams().isEmpty(), "Expected no streams");
        verifyNoInteractions(catalogProviderService, torrentSearchService);
    }

    @Test
    void testResolveStreams_whenPipelineFails_shouldReturnEmptyStreams() {
        when(catalogProviderService.getMetadata(MediaType.MOVIE, "tt0111161")).thenThrow(new IllegalStateException("lorem"));

        var result = service.resolveStreams("movie", "tt0111161");

        assertTrue(result.getStreams().isEmpty(), "Expected no streams");
    }

    @Test
    void testResolveStreams_whenTorrentLimitIsReached_shouldOnlyResolveLimitedCandidates() {
        properties.getResolution().setTorrentLimit(2);
        createService();
        var candidates = List.of(
                candidate("a1", "Movie.A", "720p"),
                candidate("a2", "Movie.B", "720p"),
                candidate("a3", "Movie.C", "720p"),
                candidate("a4", "Movie.D", "720p"));
        when(catalogProviderService.getMetadata(MediaType.MOVIE, "tt0111161")).thenReturn(Optional.of(METADATA));
        when(torrentSearchService.search("tt0111161", MediaType.MOVIE)).thenReturn(candidates);
        when(debridService.getCachedInfoHashes(anyCollection())).thenReturn(Collections.emptySet());
        when(streamResolver.resolve(any(TorrentCandidate.class), isNull()))
                .thenReturn(ResolutionOutcome.failed(FailureReason.NO_LINKS, "No links"));

        var result = service.resolveStreams("movie", "tt0111161");

        assertTrue(result.getStreams().isEmpty(), "Expected no streams");
        verify(streamResolver, times(2)).resolve(any(TorrentCandidate.class), isNull());
    }

    @Test
    void testResolveStreams_whenBatchOverDelivers_shouldCapStreamsAtMaxStreams() {
        properties.getResolution().setMaxStreams(2);
        createService();
        var candidates = List.of(
                candidate("b1", "Movie.A", "720p"),
                candidate("b2", "Movie.B", "1080p"),
                candidate("b3", "Movie.C", "2160p"));
        when(catalogProviderService.getMetadata(MediaType.MOVIE, "tt0111161")).thenReturn(Optional.of(METADATA));
        when(torrentSearchService.search("tt0111161", MediaType.MOVIE)).thenReturn(candidates);
        when(debridService.getCachedInfoHashes(anyCollection())).thenReturn(Collections.emptySet());
        when(streamResolver.resolve(any(TorrentCandidate.class), isNull()))
                .thenReturn(ResolutionOutcome.resolved(new StreamResult("https://download", "RD: Stream")));

        var result = service.resolveStreams("movie", "tt0111161");

        assertEquals(2, result.getStreams().size());
        assertEquals("RD+ 720p", result.getStreams().get(0).getName());
        assertEquals("RD+ 1080p", result.getStreams().get(1).getName());
    }

    private void createService() {
        var clock = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);
        var batchScheduler = new BatchScheduler(Runnable::run, clock);

        service = new StreamService(catalogProviderService, torrentSearchService, new AvailabilityService(debridService),
                streamResolver, batchScheduler, properties, clock);
    }

    private static TorrentCandidate candidate(String infoHash, String title, String quality) {
        return TorrentCandidate.builder()
                .title(title)
                .infoHash(infoHash)
                .magnetLink("magnet:?xt=urn:btih:" + infoHash)
                .quality(quality)
                .size("1.4 GB")
                .build();
    }
}
