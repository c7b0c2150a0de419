package com.themeboard.kr.theme;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * File-name conventions: {@code 1.전기차_1,045,470.csv}, {@code 전기차_1,045,470.csv},
 * {@code 1.전기차.csv} and {@code 전기차.csv} all carry the title {@code 전기차}.
 */
public final class ThemeFileNames {
    private static final Pattern LEADING_RANK = Pattern.compile("^\\d{1,3}\\..*");

    private ThemeFileNames() {
    }

    public static String title(String filename) {
        String base = filename == null ? "" : filename.trim();
        if (base.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            base = base.substring(0, base.length() - 4);
        }
        base = base.trim();
        if (LEADING_RANK.matcher(base).matches()) {
            base = base.substring(base.indexOf('.') + 1);
        }
        int underscore = base.lastIndexOf('_');
        if (underscore >= 0) {
            base = base.substring(0, underscore);
        }
        return base.trim();
    }

    public static boolean isThemeCsv(String filename, List<String> housekeepingPrefixes) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return false;
        }
        for (String prefix : housekeepingPrefixes) {
            if (filename.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }
}
