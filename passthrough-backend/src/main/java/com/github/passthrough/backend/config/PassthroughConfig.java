package com.github.passthrough.backend.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan({
        "com.github.passthrough.backend.config",
        "com.github.passthrough.backend.cache",
        "com.github.passthrough.backend.debrid",
        "com.github.passthrough.backend.media",
        "com.github.passthrough.backend.torrent",
        "com.github.passthrough.backend.availability",
        "com.github.passthrough.backend.stream",
})
public class PassthroughConfig {
}
