package com.github.passthrough.server.controllers;

import com.github.passthrough.server.config.properties.AddonProperties;
import com.github.passthrough.server.controllers.models.Manifest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ManifestController {
    static final String STREAM_RESOURCE = "stream";

    private final AddonProperties addonProperties;

    @RequestMapping(value = "/manifest.json", method = RequestMethod.GET)
    public Manifest manifest() {
        return Manifest.builder()
                .id(addonProperties.getId())
                .version(addonProperties.getVersion())
                .name(addonProperties.getName())
                .description(addonProperties.getDescription())
                .resources(List.of(STREAM_RESOURCE))
                .types(addonProperties.getTypes())
                .catalogs(Collections.emptyList())
                .idPrefixes(addonProperties.getIdPrefixes())
                .logo(addonProperties.getLogo())
                .background(addonProperties.getBackground())
                .behaviorHints(Map.of(
                        "configurable", false,
                        "configurationRequired", false))
                .build();
    }
}
