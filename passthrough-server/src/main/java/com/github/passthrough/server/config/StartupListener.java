package com.github.passthrough.server.config;

import com.github.passthrough.backend.config.properties.PassthroughProperties;
import com.github.passthrough.server.config.properties.AddonProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the addon address and the effective resolution limits once the server accepts requests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupListener {
    private final AddonProperties addonProperties;
    private final PassthroughProperties properties;
    private final Environment environment;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        var resolution = properties.getResolution();

        log.info("{} v{} is running", addonProperties.getName(), addonProperties.getVersion());
        log.info("Manifest available at {}/manifest.json", baseUrl());
        log.info("Resolution limits: {} torrents, {} availability checks, {} streams, {} concurrent",
                resolution.getTorrentLimit(), resolution.getAvailabilityCheckLimit(), resolution.getMaxStreams(), resolution.getMaxConcurrency());
    }

    String baseUrl() {
        if (StringUtils.isNotBlank(addonProperties.getDomain())) {
            return "https://" + addonProperties.getDomain();
        }

        return "http://localhost:" + environment.getProperty("local.server.port", environment.getProperty("server.port", "8080"));
    }
}
