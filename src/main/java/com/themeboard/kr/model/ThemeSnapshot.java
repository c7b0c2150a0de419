package com.themeboard.kr.model;

import java.util.List;

/**
 * 模块说明：ThemeSnapshot（class）。
 * 主要职责：某一天某一主题的 CSV 解析结果，只读。
 */
public final class ThemeSnapshot {
    public final String dayCode;
    public final String filename;
    public final String title;
    public final boolean tradeValueInMillions;
    public final List<InstrumentRow> rows;
    public final int malformedCells;

    public ThemeSnapshot(
            String dayCode,
            String filename,
            String title,
            boolean tradeValueInMillions,
            List<InstrumentRow> rows,
            int malformedCells
    ) {
        this.dayCode = dayCode;
        this.filename = filename;
        this.title = title;
        this.tradeValueInMillions = tradeValueInMillions;
        this.rows = rows == null ? List.of() : List.copyOf(rows);
        this.malformedCells = Math.max(0, malformedCells);
    }

    public ThemeSnapshot withRows(List<InstrumentRow> filtered) {
        return new ThemeSnapshot(dayCode, filename, title, tradeValueInMillions, filtered, malformedCells);
    }
}
