package com.github.passthrough.backend.torrent.models;

import lombok.Builder;
import lombok.Value;

/**
 * A release which can be resolved through the debrid provider.
 * The info hash is the natural key of a candidate.
 */
@Value
@Builder
public class TorrentCandidate {
    String title;
    String infoHash;
    String magnetLink;
    String quality;
    String size;
}
