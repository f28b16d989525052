package com.github.passthrough.backend.debrid.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * A single file within a torrent known by the debrid provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DebridFile {
    private Integer id;
    private String path;
    private String filename;
    private Long bytes;
    private Integer selected;

    /**
     * Get the name under which this file is matched, the path is preferred over the filename.
     *
     * @return Returns the file name if known.
     */
    public Optional<String> getName() {
        return Optional.ofNullable(path)
                .or(() -> Optional.ofNullable(filename));
    }
}
