package com.github.passthrough.backend.media.episodes;

import com.github.passthrough.backend.debrid.models.DebridFile;
import lombok.Value;

import java.util.Optional;

/**
 * The file of a torrent which has been selected for a season episode.
 */
@Value
public class MatchingFile {
    /**
     * The id of the file known by the debrid provider.
     */
    int fileId;
    /**
     * The index of the file within the file listing.
     */
    int index;
    DebridFile file;

    public Optional<DebridFile> getFile() {
        return Optional.ofNullable(file);
    }

    static MatchingFile empty() {
        return new MatchingFile(0, 0, null);
    }
}
