package com.github.passthrough.backend.media.episodes;

import com.github.passthrough.backend.debrid.models.DebridFile;
import com.github.passthrough.backend.media.ContentIds;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Matches release titles and file names against a season episode.
 * Supported formats are {@code S06E03}, {@code S6E3}, {@code 06x03}, {@code 6x03}, {@code Season 6 Episode 3} and {@code E03}.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class EpisodeMatcher {
    private static final Pattern EPISODE_TAG_PATTERN = Pattern.compile("s(\\d+)e(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final int PADDED_TAG_SCORE = 10;
    private static final int PADDED_CROSS_SCORE = 9;
    private static final int VERBOSE_SCORE = 8;
    private static final int SHORT_TAG_SCORE = 7;
    private static final int SHORT_CROSS_SCORE = 6;
    private static final int OTHER_EPISODE_PENALTY = 5;

    /**
     * Extract the season and episode from the given content id.
     * Format: {@code tt0434665:6:3} results in season 6, episode 3.
     *
     * @param contentId The content id to parse.
     * @return Returns the season episode, or null when the id is not a composite series id.
     */
    public static SeasonEpisode extractSeasonEpisode(String contentId) {
        if (contentId == null) {
            return null;
        }

        var parts = contentId.split(ContentIds.SEPARATOR);
        if (parts.length < 3) {
            return null;
        }

        try {
            return new SeasonEpisode(Integer.parseInt(parts[1].trim()), Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Check if the given title matches the season episode in any of the supported formats.
     *
     * @param title   The release title.
     * @param season  The season to match.
     * @param episode The episode to match.
     * @return Returns true when at least one format matches.
     */
    public static boolean matchesEpisode(String title, int season, int episode) {
        if (StringUtils.isEmpty(title) || season <= 0 || episode <= 0) {
            return false;
        }

        var format = new EpisodeFormat(season, episode);
        return format.paddedTag().matcher(title).find()
                || format.shortTag().matcher(title).find()
                || format.shortCross().matcher(title).find()
                || format.paddedCross().matcher(title).find()
                || format.verbose().matcher(title).find()
                || format.episodeOnly().matcher(title).find();
    }

    /**
     * Score how well the given title matches the season episode, a higher score is a better match.
     * Titles which contain multiple episode tags (packs) are penalized.
     *
     * @param title   The release title.
     * @param season  The season to match.
     * @param episode The episode to match.
     * @return Returns the match score, which can be negative.
     */
    public static int getEpisodeMatchScore(String title, int season, int episode) {
        if (StringUtils.isEmpty(title) || season <= 0 || episode <= 0) {
            return 0;
        }

        var score = formatScore(title, new EpisodeFormat(season, episode));
        var tags = EPISODE_TAG_PATTERN.matcher(title).results().count();

        if (tags > 1) {
            score -= OTHER_EPISODE_PENALTY;
        }

        return score;
    }

    /**
     * Find the file of a torrent which matches the season episode best.
     * The first file is returned when no file matches or no season episode is given.
     *
     * @param files         The file listing of the torrent.
     * @param seasonEpisode The season episode to look for, can be null.
     * @return Returns the matching file.
     */
    public static MatchingFile findMatchingFile(List<DebridFile> files, SeasonEpisode seasonEpisode) {
        if (files == null || files.isEmpty()) {
            return MatchingFile.empty();
        }
        if (seasonEpisode == null || seasonEpisode.getSeason() <= 0 || seasonEpisode.getEpisode() <= 0) {
            return firstFile(files);
        }

        var format = new EpisodeFormat(seasonEpisode.getSeason(), seasonEpisode.getEpisode());
        var bestIndex = -1;
        var bestScore = Integer.MIN_VALUE;

        // only a strictly higher score replaces the best match, which keeps the first file on ties
        for (var index = 0; index < files.size(); index++) {
            var score = fileScore(files.get(index), format, seasonEpisode);

            if (score > bestScore) {
                bestScore = score;
                bestIndex = index;
            }
        }

        if (bestScore > 0) {
            var file = files.get(bestIndex);
            log.debug("Found matching file {} (score: {})", StringUtils.abbreviate(nameOf(file), 60), bestScore);
            return new MatchingFile(fileIdOf(file, bestIndex), bestIndex, file);
        }

        log.debug("No clear episode match in filenames, using first file");
        return firstFile(files);
    }

    private static int fileScore(DebridFile file, EpisodeFormat format, SeasonEpisode seasonEpisode) {
        if (file == null) {
            return 0;
        }

        var filename = nameOf(file).toLowerCase();
        var score = formatScore(filename, format);
        var matcher = EPISODE_TAG_PATTERN.matcher(filename);

        while (matcher.find()) {
            if (parseNumber(matcher.group(1)) != seasonEpisode.getSeason() || parseNumber(matcher.group(2)) != seasonEpisode.getEpisode()) {
                score -= OTHER_EPISODE_PENALTY;
            }
        }

        return score;
    }

    private static int formatScore(String text, EpisodeFormat format) {
        var score = 0;

        if (format.paddedTag().matcher(text).find()) {
            score += PADDED_TAG_SCORE;
        }
        if (format.paddedCross().matcher(text).find()) {
            score += PADDED_CROSS_SCORE;
        }
        if (format.verbose().matcher(text).find()) {
            score += VERBOSE_SCORE;
        }
        if (format.shortTag().matcher(text).find()) {
            score += SHORT_TAG_SCORE;
        }
        if (format.shortCross().matcher(text).find()) {
            score += SHORT_CROSS_SCORE;
        }

        return score;
    }

    private static MatchingFile firstFile(List<DebridFile> files) {
        var file = files.get(0);
        var fileId = file != null && file.getId() != null ? file.getId() : 0;

        return new MatchingFile(fileId, 0, file);
    }

    private static int fileIdOf(DebridFile file, int index) {
        var id = file.getId();
        return id != null && id != 0 ? id : index;
    }

    private static String nameOf(DebridFile file) {
        return file.getName().orElse(StringUtils.EMPTY);
    }

    private static int parseNumber(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private record EpisodeFormat(String season, String episode, String paddedSeason, String paddedEpisode) {
        EpisodeFormat(int season, int episode) {
            this(String.valueOf(season), String.valueOf(episode),
                    StringUtils.leftPad(String.valueOf(season), 2, '0'),
                    StringUtils.leftPad(String.valueOf(episode), 2, '0'));
        }

        Pattern paddedTag() {
            return compile("s" + paddedSeason + "e" + paddedEpisode + "(?!\\d)");
        }

        Pattern shortTag() {
            return compile("s" + season + "e" + episode + "(?!\\d)");
        }

        Pattern paddedCross() {
            return compile("\\b" + paddedSeason + "x" + paddedEpisode + "\\b");
        }

        Pattern shortCross() {
            return compile("\\b" + season + "x" + paddedEpisode + "\\b");
        }

        Pattern verbose() {
            return compile("season\\s*" + season + "\\s*episode\\s*" + episode);
        }

        Pattern episodeOnly() {
            return compile("\\be" + paddedEpisode + "\\b");
        }

        private static Pattern compile(String regex) {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }
    }
}
