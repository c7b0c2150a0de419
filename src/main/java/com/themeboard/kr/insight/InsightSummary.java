package com.themeboard.kr.insight;

import java.util.List;

/**
 * 模块说明：InsightSummary（class）。
 * 主要职责：回看窗口内的热门主题与上升主题。
 */
public final class InsightSummary {
    public final int lookbackDays;
    public final int topN;
    public final boolean excludeDominant;
    public final List<String> dates;
    public final List<HotTheme> hottest;
    public final List<RisingTheme> rising;

    public InsightSummary(
            int lookbackDays,
            int topN,
            boolean excludeDominant,
            List<String> dates,
            List<HotTheme> hottest,
            List<RisingTheme> rising
    ) {
        this.lookbackDays = lookbackDays;
        this.topN = topN;
        this.excludeDominant = excludeDominant;
        this.dates = dates == null ? List.of() : List.copyOf(dates);
        this.hottest = hottest == null ? List.of() : List.copyOf(hottest);
        this.rising = rising == null ? List.of() : List.copyOf(rising);
    }
}
