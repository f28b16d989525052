package com.github.passthrough.server.controllers.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class Manifest {
    String id;
    String version;
    String name;
    String description;
    List<String> resources;
    List<String> types;
    List<Object> catalogs;
    List<String> idPrefixes;
    String logo;
    String background;
    Map<String, Boolean> behaviorHints;
}
