package com.github.passthrough.backend.stream.models;

import lombok.Value;

/**
 * The playable url of a resolved torrent.
 */
@Value
public class StreamResult {
    String url;
    String title;
}
