package com.github.passthrough.backend.media.providers.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The canonical metadata of a title within the catalog service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Metadata {
    private String id;
    private String type;
    private String name;
    /**
     * The release year, series use a range such as {@code 2005-2013}.
     */
    private String year;
}
