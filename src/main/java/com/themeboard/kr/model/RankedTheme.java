package com.themeboard.kr.model;

import java.util.List;

public final class RankedTheme {
    public final int rank;
    public final String title;
    public final long tradeSum;
    public final String filename;
    public final List<InstrumentRow> preview;

    public RankedTheme(int rank, String title, long tradeSum, String filename, List<InstrumentRow> preview) {
        this.rank = rank;
        this.title = title == null ? "" : title;
        this.tradeSum = tradeSum;
        this.filename = filename == null ? "" : filename;
        this.preview = preview == null ? List.of() : List.copyOf(preview);
    }

    public RankedTheme withPreview(List<InstrumentRow> rows) {
        return new RankedTheme(rank, title, tradeSum, filename, rows);
    }
}
