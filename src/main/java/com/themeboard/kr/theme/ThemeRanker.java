package com.themeboard.kr.theme;

import com.themeboard.kr.model.InstrumentRow;
import com.themeboard.kr.model.RankedTheme;
import com.themeboard.kr.model.ThemeSnapshot;
import com.themeboard.utils.Numbers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 模块说明：ThemeRanker（class）。
 * 主要职责：按主题成交额合计对某一天的主题排序；排除龙头股开关会同时影响成分股与排名。
 * 处理流程：读取 → （可选）剔除龙头股 → 合计成交额 → 合计降序、标题升序、文件名升序。
 */
public class ThemeRanker {
    private static final Comparator<Aggregate> RANK_ORDER = Comparator
            .comparingLong((Aggregate a) -> a.tradeSum).reversed()
            .thenComparing(a -> a.snapshot.title)
            .thenComparing(a -> a.snapshot.filename);

    private final ThemeSnapshotStore store;
    private final DominantInstrumentFilter dominantFilter;

    public ThemeRanker(ThemeSnapshotStore store, DominantInstrumentFilter dominantFilter) {
        this.store = store;
        this.dominantFilter = dominantFilter;
    }

    /**
     * Ranked themes without preview rows.
     */
    public List<RankedTheme> rankThemes(String dayCode, boolean excludeDominant) {
        List<RankedTheme> out = new ArrayList<>();
        List<Aggregate> ranked = aggregate(dayCode, excludeDominant);
        for (int i = 0; i < ranked.size(); i++) {
            Aggregate a = ranked.get(i);
            out.add(new RankedTheme(i + 1, a.snapshot.title, a.tradeSum, a.snapshot.filename, List.of()));
        }
        return out;
    }

    /**
     * Top {@code limit} themes, each carrying its first {@code previewN} rows after the preview sort.
     */
    public List<RankedTheme> rankThemes(String dayCode, boolean excludeDominant, PreviewSort sort, int limit, int previewN) {
        List<Aggregate> ranked = aggregate(dayCode, excludeDominant);
        int n = Math.min(Math.max(0, limit), ranked.size());
        List<RankedTheme> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Aggregate a = ranked.get(i);
            List<InstrumentRow> sorted = sort.sort(a.snapshot.rows, a.snapshot.tradeValueInMillions);
            List<InstrumentRow> preview = sorted.subList(0, Math.min(Math.max(0, previewN), sorted.size()));
            out.add(new RankedTheme(i + 1, a.snapshot.title, a.tradeSum, a.snapshot.filename, preview));
        }
        return out;
    }

    /**
     * The theme at {@code rank} (1-based) with all of its rows sorted for display.
     */
    public Optional<RankedTheme> themeAt(String dayCode, int rank, boolean excludeDominant, PreviewSort sort) {
        List<Aggregate> ranked = aggregate(dayCode, excludeDominant);
        if (rank < 1 || rank > ranked.size()) {
            return Optional.empty();
        }
        Aggregate a = ranked.get(rank - 1);
        List<InstrumentRow> rows = sort.sort(a.snapshot.rows, a.snapshot.tradeValueInMillions);
        return Optional.of(new RankedTheme(rank, a.snapshot.title, a.tradeSum, a.snapshot.filename, rows));
    }

    public ThemeSnapshotStore store() {
        return store;
    }

    /**
     * Trade values are summed as written; a "(백만)" column is not rescaled here.
     */
    static long tradeSum(List<InstrumentRow> rows) {
        double sum = 0.0;
        for (InstrumentRow row : rows) {
            Double v = Numbers.parsePlain(row.tradeValue);
            if (v != null) {
                sum += v;
            }
        }
        return (long) sum;
    }

    private List<Aggregate> aggregate(String dayCode, boolean excludeDominant) {
        List<Aggregate> out = new ArrayList<>();
        for (ThemeSnapshot snapshot : store.readDay(dayCode)) {
            ThemeSnapshot effective = excludeDominant ? snapshot.withRows(dominantFilter.filter(snapshot.rows)) : snapshot;
            out.add(new Aggregate(effective, tradeSum(effective.rows)));
        }
        out.sort(RANK_ORDER);
        return out;
    }

    private static final class Aggregate {
        private final ThemeSnapshot snapshot;
        private final long tradeSum;

        private Aggregate(ThemeSnapshot snapshot, long tradeSum) {
            this.snapshot = snapshot;
            this.tradeSum = tradeSum;
        }
    }
}
