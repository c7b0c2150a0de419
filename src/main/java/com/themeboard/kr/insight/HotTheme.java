package com.themeboard.kr.insight;

/**
 * One theme's appearance statistics over the lookback window.
 */
public final class HotTheme {
    public final String title;
    public final int frequency;
    public final double avgRank;
    public final long avgTradeSum;
    public final double momentumScore;
    public final String lastSeen;
    public final int lastRank;

    public HotTheme(String title, int frequency, double avgRank, long avgTradeSum, double momentumScore, String lastSeen, int lastRank) {
        this.title = title;
        this.frequency = frequency;
        this.avgRank = avgRank;
        this.avgTradeSum = avgTradeSum;
        this.momentumScore = momentumScore;
        this.lastSeen = lastSeen;
        this.lastRank = lastRank;
    }
}
