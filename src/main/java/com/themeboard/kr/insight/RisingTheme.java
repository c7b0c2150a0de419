package com.themeboard.kr.insight;

public final class RisingTheme {
    public final String title;
    public final double improvement;
    public final double olderAvgRank;
    public final double newerAvgRank;
    public final int newerFrequency;

    public RisingTheme(String title, double improvement, double olderAvgRank, double newerAvgRank, int newerFrequency) {
        this.title = title;
        this.improvement = improvement;
        this.olderAvgRank = olderAvgRank;
        this.newerAvgRank = newerAvgRank;
        this.newerFrequency = newerFrequency;
    }
}
