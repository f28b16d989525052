package com.github.passthrough.server.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import java.util.List;

/**
 * The identity of the addon as advertised through the manifest.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties("passthrough.addon")
public class AddonProperties {
    @NotBlank
    private String id = "community.stremio.rd.passthrough";
    @NotBlank
    private String version = "1.0.0";
    @NotBlank
    private String name = "Real-Debrid Passthrough";
    private String description = "Stream via Real-Debrid with passthrough (no downloads)";
    @NotEmpty
    private List<String> types = List.of("movie", "series");
    @NotEmpty
    private List<String> idPrefixes = List.of("tt");
    private String logo = "https://i.imgur.com/8VIqPYB.jpg";
    private String background = "https://i.imgur.com/8VIqPYB.jpg";
    /**
     * The public domain under which the addon is reachable.
     * The local address is advertised when absent.
     */
    private String domain;
}
