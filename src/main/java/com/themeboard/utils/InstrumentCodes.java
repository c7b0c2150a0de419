package com.themeboard.utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * KRX instrument code normalization: the first run of 5-6 digits, left-padded to 6.
 * "A005930", "05930.0", "005930 KS" all become "005930"; "12" or "ABC" become "".
 */
public final class InstrumentCodes {
    public static final int WIDTH = 6;
    private static final Pattern CODE_DIGITS = Pattern.compile("(\\d{5,6})");

    private InstrumentCodes() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.trim();
        if (s.isEmpty() || "nan".equalsIgnoreCase(s) || "none".equalsIgnoreCase(s)) {
            return "";
        }
        Matcher m = CODE_DIGITS.matcher(s);
        if (!m.find()) {
            return "";
        }
        String digits = m.group(1);
        return digits.length() < WIDTH ? "0" + digits : digits;
    }

    public static boolean isNormalized(String code) {
        return code != null && code.length() == WIDTH && code.chars().allMatch(Character::isDigit);
    }
}
