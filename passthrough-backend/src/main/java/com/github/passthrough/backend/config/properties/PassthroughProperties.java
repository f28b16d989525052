package com.github.passthrough.backend.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties("passthrough")
public class PassthroughProperties {
    /**
     * The debrid provider which materializes the torrents into direct links.
     */
    @Valid
    @NotNull
    private DebridProperties debrid = new DebridProperties();

    /**
     * The catalog service which provides the title metadata.
     */
    @Valid
    @NotNull
    private ProviderProperties catalog = ProviderProperties.of("https://v3-cinemeta.strem.io", null, null);

    /**
     * The release aggregator which provides the torrent candidates.
     */
    @Valid
    @NotNull
    private ProviderProperties aggregator = ProviderProperties.of("https://torrentio.strem.fun", Duration.ofSeconds(10), "Stremio");

    /**
     * The limits of the stream resolution.
     */
    @Valid
    @NotNull
    private ResolutionProperties resolution = new ResolutionProperties();

    /**
     * The time-to-live of the caches.
     */
    @Valid
    @NotNull
    private CacheProperties cache = new CacheProperties();
}
