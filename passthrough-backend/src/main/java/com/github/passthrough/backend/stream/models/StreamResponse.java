package com.github.passthrough.backend.stream.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamResponse {
    private List<PlayableStream> streams;

    public static StreamResponse empty() {
        return new StreamResponse(Collections.emptyList());
    }
}
