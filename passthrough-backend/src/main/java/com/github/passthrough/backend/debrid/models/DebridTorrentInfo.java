package com.github.passthrough.backend.debrid.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DebridTorrentInfo {
    public static final String STATUS_DOWNLOADED = "downloaded";
    public static final String STATUS_WAITING_FILES_SELECTION = "waiting_files_selection";

    private String id;
    private String filename;
    private String status;
    private List<String> links;
    private List<DebridFile> files;

    /**
     * Verify if the torrent reached a state in which its links can be used.
     *
     * @return Returns true when the torrent is downloaded or waiting for a file selection.
     */
    @JsonIgnore
    public boolean isReady() {
        return STATUS_DOWNLOADED.equals(status) || STATUS_WAITING_FILES_SELECTION.equals(status);
    }

    public List<String> getLinks() {
        return Optional.ofNullable(links).orElse(Collections.emptyList());
    }

    public List<DebridFile> getFiles() {
        return Optional.ofNullable(files).orElse(Collections.emptyList());
    }
}
