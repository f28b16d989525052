package com.github.passthrough.backend.media;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * Content ids identify a title, series episodes use the composite form {@code <baseId>:<season>:<episode>}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ContentIds {
    public static final String SEPARATOR = ":";

    /**
     * Strip the season and episode from the given content id.
     *
     * @param contentId The content id, e.g. {@code tt0434665:6:3}.
     * @return Returns the base id, e.g. {@code tt0434665}.
     */
    public static String baseId(String contentId) {
        Objects.requireNonNull(contentId, "contentId cannot be null");
        var index = contentId.indexOf(SEPARATOR);

        return index >= 0 ? contentId.substring(0, index) : contentId;
    }
}
