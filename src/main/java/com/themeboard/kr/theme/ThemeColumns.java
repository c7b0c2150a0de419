package com.themeboard.kr.theme;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 模块说明：ThemeColumns（class）。
 * 主要职责：每个文件读取时解析一次表头，得到规范列到列下标的映射。
 * 使用建议：新增表头写法时在 ThemeColumn 中登记别名并提升 VERSION。
 */
public final class ThemeColumns {
    public static final int VERSION = 2;
    private static final String MILLIONS_MARKER = "백만";

    private final Map<ThemeColumn, Integer> indexes;
    private final boolean tradeValueInMillions;

    private ThemeColumns(Map<ThemeColumn, Integer> indexes, boolean tradeValueInMillions) {
        this.indexes = Collections.unmodifiableMap(indexes);
        this.tradeValueInMillions = tradeValueInMillions;
    }

    public static ThemeColumns resolve(String[] header) {
        Map<ThemeColumn, Integer> indexes = new EnumMap<>(ThemeColumn.class);
        boolean millions = false;
        if (header != null) {
            for (ThemeColumn column : ThemeColumn.values()) {
                int idx = indexOf(header, column);
                if (idx >= 0) {
                    indexes.put(column, idx);
                    if (column == ThemeColumn.TRADE_VALUE && header[idx].contains(MILLIONS_MARKER)) {
                        millions = true;
                    }
                }
            }
        }
        return new ThemeColumns(indexes, millions);
    }

    public boolean has(ThemeColumn column) {
        return indexes.containsKey(column);
    }

    /**
     * Empty string when the column is absent or the row is short.
     */
    public String cell(String[] row, ThemeColumn column) {
        Integer idx = indexes.get(column);
        if (idx == null || row == null || idx >= row.length || row[idx] == null) {
            return "";
        }
        return row[idx].trim();
    }

    public boolean tradeValueInMillions() {
        return tradeValueInMillions;
    }

    private static int indexOf(String[] header, ThemeColumn column) {
        for (String alias : column.aliases()) {
            for (int i = 0; i < header.length; i++) {
                String h = header[i] == null ? "" : header[i].trim();
                if (h.equalsIgnoreCase(alias)) {
                    return i;
                }
            }
        }
        return -1;
    }
}
