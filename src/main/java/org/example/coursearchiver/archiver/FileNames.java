package org.example.coursearchiver.archiver;

import java.util.regex.Pattern;

/**
 * File-system safe names for titles taken from the site. Lengths are capped per directory level
 * so that the full path stays under the Windows path limit.
 */
public final class FileNames {

    static final int PATH_TITLE_MAX = 35;
    static final int PATH_COURSE_TITLE_MAX = 30;
    static final int STANDALONE_COURSE_TITLE_MAX = 80;
    static final int CHAPTER_TITLE_MAX = 35;
    static final int UNIT_TITLE_MAX = 35;

    private static final Pattern FORBIDDEN = Pattern.compile("[ºª\\r\\n]|[^\\p{L}\\p{N}_\\s]");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final String EMPTY_FALLBACK = "sin titulo";

    private FileNames() {
    }

    /**
     * Drops punctuation and symbols, collapses whitespace and truncates to {@code maxLength}.
     */
    public static String clean(String text, int maxLength) {
        if (text == null) {
            return EMPTY_FALLBACK;
        }
        String result = FORBIDDEN.matcher(text).replaceAll("");
        result = SPACES.matcher(result).replaceAll(" ").trim();
        if (result.length() > maxLength) {
            result = result.substring(0, maxLength).trim();
        }
        return result.isEmpty() ? EMPTY_FALLBACK : result;
    }

    /**
     * Cleans only the name part of {@code fileName}, keeping its extension.
     */
    public static String cleanKeepingExtension(String fileName, int maxLength) {
        if (fileName == null || fileName.isBlank()) {
            return EMPTY_FALLBACK;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return clean(fileName, maxLength);
        }
        String extension = fileName.substring(dot).replaceAll("[^.\\p{Alnum}]", "");
        return clean(fileName.substring(0, dot), maxLength) + extension;
    }

    public static String numbered(int index, String text, int maxLength) {
        return index + ". " + clean(text, maxLength);
    }
}
