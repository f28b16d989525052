package com.github.passthrough.backend.stream.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stream as presented to the addon client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayableStream {
    private String name;
    private String title;
    private String url;
    private BehaviorHints behaviorHints;
}
