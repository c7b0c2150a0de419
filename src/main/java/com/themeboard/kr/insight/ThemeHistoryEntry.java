package com.themeboard.kr.insight;

public final class ThemeHistoryEntry {
    public final String dayCode;
    public final String title;
    public final int rank;
    public final long tradeSum;
    public final String filename;

    public ThemeHistoryEntry(String dayCode, String title, int rank, long tradeSum, String filename) {
        this.dayCode = dayCode;
        this.title = title;
        this.rank = rank;
        this.tradeSum = tradeSum;
        this.filename = filename;
    }
}
