package com.themeboard.utils;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient numeric parsing for scraped table cells ("1,234", "+3.5%", "12,345억").
 */
public final class Numbers {
    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+(?:\\.\\d+)?");

    private Numbers() {
    }

    /**
     * Returns null when the cell carries no number at all.
     */
    public static Double parse(String raw) {
        String s = raw == null ? "" : raw.trim();
        if (s.isEmpty()) {
            return null;
        }
        s = s.replace(",", "").replace("%", "").replace("+", "");
        Matcher m = NUMBER.matcher(s);
        if (!m.find()) {
            return null;
        }
        try {
            double v = Double.parseDouble(m.group());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    public static double toDouble(String raw) {
        Double v = parse(raw);
        return v == null ? 0.0 : v;
    }

    public static long toLong(String raw) {
        return (long) toDouble(raw);
    }

    /**
     * Strict variant for trade-value sums: only commas are stripped, anything else that is not a
     * plain number is treated as malformed.
     */
    public static Double parsePlain(String raw) {
        String s = raw == null ? "" : raw.replace(",", "").trim();
        if (s.isEmpty()) {
            return null;
        }
        try {
            double v = Double.parseDouble(s);
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    public static String formatPct(double value) {
        return String.format(Locale.US, "%+.2f%%", value);
    }

    /**
     * Prices render as integers when they have no fractional part.
     */
    public static String formatPrice(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return String.format(Locale.US, "%.2f", value);
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
