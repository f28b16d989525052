package com.github.passthrough.backend.debrid.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnrestrictResponse {
    /**
     * The direct download url of the unrestricted link.
     */
    private String download;
    private String filename;
}
