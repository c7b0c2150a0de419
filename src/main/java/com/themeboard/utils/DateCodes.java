package com.themeboard.utils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * 模块说明：DateCodes（class）。
 * 主要职责：在目录名使用的 yymmdd 与 yyyymmdd / LocalDate 之间互相转换。
 */
public final class DateCodes {
    public static final Pattern YYMMDD = Pattern.compile("^\\d{6}$");
    public static final Pattern YYYYMMDD = Pattern.compile("^\\d{8}$");
    private static final DateTimeFormatter YYMMDD_FMT = DateTimeFormatter.ofPattern("yyMMdd");
    private static final DateTimeFormatter YYYYMMDD_FMT = DateTimeFormatter.BASIC_ISO_DATE;

    private DateCodes() {
    }

    public static boolean isDayCode(String value) {
        return value != null && YYMMDD.matcher(value).matches();
    }

    /**
     * 00~69 map to 20xx, 70~99 to 19xx. Returns "" when the input is not six digits.
     */
    public static String toYyyymmdd(String yymmdd) {
        String v = yymmdd == null ? "" : yymmdd.trim();
        if (!YYMMDD.matcher(v).matches()) {
            return "";
        }
        int yy = Integer.parseInt(v.substring(0, 2));
        int yyyy = yy <= 69 ? 2000 + yy : 1900 + yy;
        return String.format("%04d%s", yyyy, v.substring(2));
    }

    public static String toYymmdd(String yyyymmdd) {
        String v = yyyymmdd == null ? "" : yyyymmdd.replace("-", "").trim();
        if (!YYYYMMDD.matcher(v).matches()) {
            return "";
        }
        return v.substring(2);
    }

    /**
     * Accepts yymmdd, yyyymmdd or yyyy-mm-dd. Returns null when nothing parses.
     */
    public static LocalDate parseDay(String value) {
        String v = value == null ? "" : value.replace("-", "").trim();
        if (YYMMDD.matcher(v).matches()) {
            v = toYyyymmdd(v);
        }
        if (!YYYYMMDD.matcher(v).matches()) {
            return null;
        }
        try {
            return LocalDate.parse(v, YYYYMMDD_FMT);
        } catch (Exception ignored) {
            return null;
        }
    }

    public static String formatDay(LocalDate day) {
        return day == null ? "" : YYMMDD_FMT.format(day);
    }

    /**
     * Sortable yyyymmdd key for ledger ordering; "" when the value is not a recognised date.
     */
    public static String sortKey(String value) {
        String v = value == null ? "" : value.replace("-", "").trim();
        if (YYMMDD.matcher(v).matches()) {
            return toYyyymmdd(v);
        }
        if (YYYYMMDD.matcher(v).matches()) {
            return v;
        }
        return "";
    }
}
