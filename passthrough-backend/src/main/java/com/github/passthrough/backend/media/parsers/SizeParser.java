package com.github.passthrough.backend.media.parsers;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class SizeParser {
    private static final Pattern SIZE_PATTERN = Pattern.compile("💾\\s*([0-9]+(?:[.,][0-9]+)?)\\s*([KMGT]i?B)", Pattern.CASE_INSENSITIVE);

    /**
     * Extract the size label from the given release title, e.g. {@code 1.4 GB}.
     *
     * @param rawTitle The release title of the aggregator.
     * @return Returns the size label if present.
     */
    public static Optional<String> extractSize(String rawTitle) {
        return Optional.ofNullable(rawTitle)
                .map(SIZE_PATTERN::matcher)
                .filter(Matcher::find)
                .map(e -> e.group(1) + " " + e.group(2).toUpperCase());
    }
}
