package com.github.passthrough.backend.stream.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BehaviorHints {
    private String bingeGroup;
    private boolean notWebReady;
}
