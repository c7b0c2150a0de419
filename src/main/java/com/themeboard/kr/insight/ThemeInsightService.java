package com.themeboard.kr.insight;

import com.themeboard.kr.model.RankedTheme;
import com.themeboard.kr.theme.ThemeRanker;
import com.themeboard.utils.Numbers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：ThemeInsightService（class）。
 * 主要职责：在最近 N 个快照日上统计主题出现频率、时间加权动量与前后半段排名改善。
 * 使用建议：调用方负责对 lookback/topN 做区间裁剪。
 */
public class ThemeInsightService {
    private static final Logger LOG = LogManager.getLogger(ThemeInsightService.class);

    private final ThemeRanker ranker;
    private final int maxEntries;

    public ThemeInsightService(ThemeRanker ranker, int maxEntries) {
        this.ranker = ranker;
        this.maxEntries = Math.max(1, maxEntries);
    }

    public InsightSummary summarize(int lookbackDays, int topN, boolean excludeDominant) {
        List<String> dates = recentDays(lookbackDays);
        if (dates.isEmpty()) {
            return new InsightSummary(lookbackDays, topN, excludeDominant, List.of(), List.of(), List.of());
        }
        int keep = Math.max(1, topN);
        Map<String, List<Appearance>> history = new LinkedHashMap<>();
        for (int i = 0; i < dates.size(); i++) {
            String day = dates.get(i);
            List<RankedTheme> ranked = ranker.rankThemes(day, excludeDominant);
            for (RankedTheme theme : ranked.subList(0, Math.min(keep, ranked.size()))) {
                if (theme.title.isEmpty()) {
                    continue;
                }
                history.computeIfAbsent(theme.title, k -> new ArrayList<>())
                        .add(new Appearance(i, day, theme.rank, theme.tradeSum));
            }
        }
        List<HotTheme> hottest = hottest(history, dates.size(), topN);
        List<RisingTheme> rising = rising(history, dates.size());
        LOG.debug("insights days={} themes={} hottest={} rising={}", dates.size(), history.size(), hottest.size(), rising.size());
        return new InsightSummary(lookbackDays, topN, excludeDominant, dates, hottest, rising);
    }

    /**
     * Per day, the best-ranked theme whose title contains {@code titleSubstring} (case-insensitive).
     */
    public List<ThemeHistoryEntry> themeHistory(String titleSubstring, int lookbackDays, boolean excludeDominant) {
        String needle = titleSubstring == null ? "" : titleSubstring.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return List.of();
        }
        List<ThemeHistoryEntry> out = new ArrayList<>();
        for (String day : recentDays(lookbackDays)) {
            for (RankedTheme theme : ranker.rankThemes(day, excludeDominant)) {
                if (theme.title.toLowerCase(Locale.ROOT).contains(needle)) {
                    out.add(new ThemeHistoryEntry(day, theme.title, theme.rank, theme.tradeSum, theme.filename));
                    break;
                }
            }
        }
        return out;
    }

    private List<String> recentDays(int lookbackDays) {
        List<String> all = ranker.store().listDays();
        int n = Math.max(1, lookbackDays);
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    private List<HotTheme> hottest(Map<String, List<Appearance>> history, int dayCount, int topN) {
        List<HotTheme> out = new ArrayList<>();
        for (Map.Entry<String, List<Appearance>> e : history.entrySet()) {
            List<Appearance> rows = e.getValue();
            int freq = rows.size();
            double rankSum = 0.0;
            double tradeSum = 0.0;
            double weighted = 0.0;
            for (Appearance a : rows) {
                rankSum += a.rank;
                tradeSum += a.tradeSum;
                double w = (a.dayIndex + 1) / (double) dayCount;
                weighted += w * (topN + 1 - Math.min(a.rank, topN + 1));
            }
            Appearance last = rows.get(rows.size() - 1);
            out.add(new HotTheme(
                    e.getKey(),
                    freq,
                    Numbers.round2(rankSum / freq),
                    (long) (tradeSum / freq),
                    Numbers.round2(weighted),
                    last.day,
                    last.rank
            ));
        }
        out.sort(Comparator
                .comparingInt((HotTheme h) -> h.frequency).reversed()
                .thenComparingDouble(h -> h.avgRank)
                .thenComparing(Comparator.comparingDouble((HotTheme h) -> h.momentumScore).reversed())
                .thenComparing(Comparator.comparingLong((HotTheme h) -> h.avgTradeSum).reversed()));
        return out.subList(0, Math.min(maxEntries, out.size()));
    }

    /**
     * Themes missing from either half carry no signal and are left out.
     */
    private List<RisingTheme> rising(Map<String, List<Appearance>> history, int dayCount) {
        int split = Math.max(1, dayCount / 2);
        List<RisingTheme> out = new ArrayList<>();
        for (Map.Entry<String, List<Appearance>> e : history.entrySet()) {
            double olderSum = 0.0;
            int olderCount = 0;
            double newerSum = 0.0;
            int newerCount = 0;
            for (Appearance a : e.getValue()) {
                if (a.dayIndex < split) {
                    olderSum += a.rank;
                    olderCount++;
                } else {
                    newerSum += a.rank;
                    newerCount++;
                }
            }
            if (olderCount == 0 || newerCount == 0) {
                continue;
            }
            double olderAvg = olderSum / olderCount;
            double newerAvg = newerSum / newerCount;
            out.add(new RisingTheme(
                    e.getKey(),
                    Numbers.round2(olderAvg - newerAvg),
                    Numbers.round2(olderAvg),
                    Numbers.round2(newerAvg),
                    newerCount
            ));
        }
        out.sort(Comparator
                .comparingDouble((RisingTheme r) -> r.improvement).reversed()
                .thenComparingDouble(r -> r.newerAvgRank)
                .thenComparing(Comparator.comparingInt((RisingTheme r) -> r.newerFrequency).reversed()));
        return out.subList(0, Math.min(maxEntries, out.size()));
    }

    private static final class Appearance {
        private final int dayIndex;
        private final String day;
        private final int rank;
        private final long tradeSum;

        private Appearance(int dayIndex, String day, int rank, long tradeSum) {
            this.dayIndex = dayIndex;
            this.day = day;
            this.rank = rank;
            this.tradeSum = tradeSum;
        }
    }
}
