package com.github.passthrough.backend.debrid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.backend.debrid.models.AddMagnetResponse;
import com.github.passthrough.backend.debrid.models.DebridTorrentInfo;
import com.github.passthrough.backend.debrid.models.UnrestrictResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RealDebridServiceTest {
    private static final String MAGNET = "magnet:?xt=urn:btih:8f3b2c5d9e1a7f4b6c0d2e8a1b3c5d7e9f0a2b4c";

    @Mock
    private RestTemplate restTemplate;

    private RealDebridService service;

    @BeforeEach
    void setUp() {
        service = new RealDebridService(restTemplate, new PassthroughProperties());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testAddMagnet_whenProviderReturnsId_shouldPostMagnetAsForm() {
        var uriCaptor = ArgumentCaptor.forClass(URI.class);
        var entityCaptor = ArgumentCaptor.forClass(HttpEntity.class);
        when(restTemplate.postForEntity(isA(URI.class), isA(HttpEntity.class), eq(AddMagnetResponse.class)))
                .thenReturn(ResponseEntity.ok(new AddMagnetResponse("ABCDEF", "https://api.real-debrid.com/rest/1.0/torrents/info/ABCDEF")));

        var result = service.addMagnet(MAGNET);

        verify(restTemplate).postForEntity(uriCaptor.capture(), entityCaptor.capture(), eq(AddMagnetResponse.class));
        var entity = (HttpEntity<MultiValueMap<String, String>>) entityCaptor.getValue();
        assertEquals("ABCDEF", result.getId());
        assertEquals("/rest/1.0/torrents/addMagnet", uriCaptor.getValue().getPath());
        assertEquals(MediaType.APPLICATION_FORM_URLENCODED, entity.getHeaders().getContentType());
        assertEquals(MAGNET, entity.getBody().getFirst("magnet"));
    }

    @Test
    void testAddMagnet_whenProviderReturnsNoId_shouldThrowDebridException() {
        when(restTemplate.postForEntity(isA(URI.class), isA(HttpEntity.class), eq(AddMagnetResponse.class)))
                .thenReturn(ResponseEntity.ok(new AddMagnetResponse()));

        assertThrows(DebridException.class, () -> service.addMagnet(MAGNET));
    }

    @Test
    void testGetTorrentInfo_whenBodyIsMissing_shouldThrowDebridException() {
        when(restTemplate.getForEntity(isA(URI.class), eq(DebridTorrentInfo.class))).thenReturn(ResponseEntity.ok().build());

        assertThrows(DebridException.class, () -> service.getTorrentInfo("ABCDEF"));
    }

    @Test
    void testGetTorrentInfo_whenProviderReturnsInfo_shouldRequestTorrentById() {
        var uriCaptor = ArgumentCaptor.forClass(URI.class);
        var info = DebridTorrentInfo.builder()
                .id("ABCDEF")
                .status(DebridTorrentInfo.STATUS_DOWNLOADED)
                .links(List.of("https://real-debrid.com/d/LINK1"))
                .build();
        when(restTemplate.getForEntity(isA(URI.class), eq(DebridTorrentInfo.class))).thenReturn(ResponseEntity.ok(info));

        var result = service.getTorrentInfo("ABCDEF");

        verify(restTemplate).getForEntity(uriCaptor.capture(), eq(DebridTorrentInfo.class));
        assertEquals("/rest/1.0/torrents/info/ABCDEF", uriCaptor.getValue().getPath());
        assertTrue(result.isReady(), "Expected the torrent to be ready");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSelectFiles_whenFileIdsIsBlank_shouldSelectAllFiles() {
        var entityCaptor = ArgumentCaptor.forClass(HttpEntity.class);

        service.selectFiles("ABCDEF", " ");

        verify(restTemplate).postForEntity(isA(URI.class), entityCaptor.capture(), eq(Void.class));
        var entity = (HttpEntity<MultiValueMap<String, String>>) entityCaptor.getValue();
        assertEquals(DebridService.ALL_FILES, entity.getBody().getFirst("files"));
    }

    @Test
    void testUnrestrictLink_whenDownloadIsMissing_shouldThrowDebridException() {
        when(restTemplate.postForEntity(isA(URI.class), isA(HttpEntity.class), eq(UnrestrictResponse.class)))
                .thenReturn(ResponseEntity.ok(new UnrestrictResponse("", "Show.S06E03.mkv")));

        assertThrows(DebridException.class, () -> service.unrestrictLink("https://real-debrid.com/d/LINK1"));
    }

    @Test
    void testGetCachedInfoHashes_whenProviderReturnsVariants_shouldOnlyReturnNonEmptyObjects() throws Exception {
        var body = new ObjectMapper().readTree("{" +
                "\"AAAA\": {\"rd\": [{\"1\": {\"filename\": \"Show.S06E03.mkv\", \"filesize\": 1024}}]}," +
                "\"bbbb\": {}," +
                "\"cccc\": []" +
                "}");
        when(restTemplate.getForEntity(isA(URI.class), eq(JsonNode.class))).thenReturn(ResponseEntity.ok(body));

        var result = service.getCachedInfoHashes(List.of("aaaa", "bbbb", "cccc"));

        assertEquals(Set.of("aaaa"), result);
    }

    @Test
    void testGetCachedInfoHashes_whenHashesIsEmpty_shouldNotInvokeProvider() {
        var result = service.getCachedInfoHashes(Collections.emptyList());

        assertTrue(result.isEmpty(), "Expected no cached hashes");
        verifyNoInteractions(restTemplate);
    }
}
