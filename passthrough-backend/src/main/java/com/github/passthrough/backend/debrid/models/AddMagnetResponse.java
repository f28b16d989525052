package com.github.passthrough.backend.debrid.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AddMagnetResponse {
    /**
     * The provider-side id of the torrent.
     */
    private String id;
    private String uri;
}
