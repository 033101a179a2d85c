package com.materialport.converter.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

@UtilityClass
public class FileNameUtil {

    public static final String UNNAMED = "unnamed_material";

    private static final Pattern INVALID_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1f]");

    /**
     * Replace characters that are invalid in file names on common platforms.
     * Example: "Glass: Blue/Clear" -> "Glass_ Blue_Clear"
     */
    public static String sanitize(String name) {
        if (name == null) return UNNAMED;

        String cleaned = INVALID_CHARS.matcher(name).replaceAll("_")
                .replaceAll("_+", "_")
                .replaceAll("^[_\\s]+|[_\\s]+$", "");
        return cleaned.isEmpty() ? UNNAMED : cleaned;
    }

    /**
     * Returns {@code base}, or {@code base_2}, {@code base_3}... whichever is
     * not yet in {@code used}, ignoring case so the names stay distinct on
     * case-insensitive file systems. The lower-cased choice is added to {@code used}.
     */
    public static String uniqueName(String base, Set<String> used) {
        String candidate = base;
        int counter = 2;
        while (used.contains(candidate.toLowerCase(Locale.ROOT))) {
            candidate = base + "_" + counter++;
        }
        used.add(candidate.toLowerCase(Locale.ROOT));
        return candidate;
    }
}
