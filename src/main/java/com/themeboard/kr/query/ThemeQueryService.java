package com.themeboard.kr.query;

import com.themeboard.kr.config.Config;
import com.themeboard.kr.forward.ForwardContext;
import com.themeboard.kr.forward.ForwardReturnJoiner;
import com.themeboard.kr.insight.InsightSummary;
import com.themeboard.kr.insight.ThemeHistoryEntry;
import com.themeboard.kr.insight.ThemeInsightService;
import com.themeboard.kr.ledger.LedgerColumn;
import com.themeboard.kr.ledger.LedgerListing;
import com.themeboard.kr.ledger.LedgerRecord;
import com.themeboard.kr.ledger.RecordLedger;
import com.themeboard.kr.model.InstrumentRow;
import com.themeboard.kr.model.RankedTheme;
import com.themeboard.kr.refresh.RefreshOrchestrator;
import com.themeboard.kr.refresh.TriggerResult;
import com.themeboard.kr.theme.PreviewSort;
import com.themeboard.kr.theme.ThemeRanker;
import com.themeboard.kr.theme.ThemeSnapshotStore;
import com.themeboard.utils.DateCodes;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：ThemeQueryService（class）。
 * 主要职责：对外查询入口，组装主题、洞察、记录与刷新状态的 JSON 响应。
 * 处理流程：参数裁剪 → 定位快照日 → （显式日期时）准备次日收益上下文 → 排名/补全 → JSON。
 * 使用建议：越界参数一律裁剪到配置区间，不报错；日期格式错误抛 IllegalArgumentException。
 */
public class ThemeQueryService {
    private final Config config;
    private final ThemeSnapshotStore store;
    private final ThemeRanker ranker;
    private final ForwardReturnJoiner joiner;
    private final ThemeInsightService insights;
    private final RecordLedger ledger;
    private final RefreshOrchestrator refresh;
    private final ResponseJsonBuilder json = new ResponseJsonBuilder();

    public ThemeQueryService(
            Config config,
            ThemeSnapshotStore store,
            ThemeRanker ranker,
            ForwardReturnJoiner joiner,
            ThemeInsightService insights,
            RecordLedger ledger,
            RefreshOrchestrator refresh
    ) {
        this.config = config;
        this.store = store;
        this.ranker = ranker;
        this.joiner = joiner;
        this.insights = insights;
        this.ledger = ledger;
        this.refresh = refresh;
    }

    public JSONObject status() {
        List<String> days = store.listDays();
        JSONObject out = new JSONObject();
        out.put("theme_root", String.valueOf(store.root()));
        out.put("dates", new JSONArray(days));
        out.put("latest", days.isEmpty() ? JSONObject.NULL : days.get(days.size() - 1));
        out.put("enable_refresh", refresh.isEnabled());
        out.put("refresh", json.refresh(refresh.status()));
        return out;
    }

    public JSONObject themes(String date, boolean excludeDominant, String sort, Integer limit, Integer previewN) {
        int lim = clamp(limit, "query.themes.limit", 1);
        int preview = clamp(previewN, "query.themes.preview", 0);
        String day = resolveDay(date);
        sort = effectiveSort(sort);
        PreviewSort previewSort = PreviewSort.parse(sort);
        ForwardContext ctx = explicit(date) ? joiner.prepare(day) : null;

        JSONArray themes = new JSONArray();
        for (RankedTheme theme : ranker.rankThemes(day, excludeDominant, previewSort, lim, preview)) {
            List<InstrumentRow> rows = ctx == null ? theme.preview : joiner.enrich(theme.preview, ctx);
            themes.put(json.theme(theme, rows, "preview"));
        }
        JSONObject out = header(day, excludeDominant, sort);
        out.put("forward", json.forward(ctx));
        out.put("themes", themes);
        return out;
    }

    public JSONObject themeDetail(int rank, String date, boolean excludeDominant, String sort) {
        String day = resolveDay(date);
        sort = effectiveSort(sort);
        Optional<RankedTheme> found = ranker.themeAt(day, rank, excludeDominant, PreviewSort.parse(sort));
        if (found.isEmpty()) {
            throw new SnapshotNotFoundException("no theme with rank=" + rank + " in " + day);
        }
        ForwardContext ctx = explicit(date) ? joiner.prepare(day) : null;
        RankedTheme theme = found.get();
        List<InstrumentRow> rows = ctx == null ? theme.preview : joiner.enrich(theme.preview, ctx);

        JSONObject out = header(day, excludeDominant, sort);
        out.put("forward", json.forward(ctx));
        JSONObject body = json.theme(theme, rows, "rows");
        for (String key : body.keySet()) {
            out.put(key, body.get(key));
        }
        return out;
    }

    public JSONObject insightsSummary(Integer lookback, Integer topN, boolean excludeDominant) {
        int days = clamp(lookback, "query.insights.lookback", 5);
        int n = clamp(topN, "query.insights.top_n", 3);
        InsightSummary summary = insights.summarize(days, n, excludeDominant);
        return json.insights(summary);
    }

    public JSONObject themeHistory(String title, Integer lookback, boolean excludeDominant) {
        int days = clamp(lookback, "query.history.lookback", 10);
        List<ThemeHistoryEntry> rows = insights.themeHistory(title, days, excludeDominant);
        JSONObject out = new JSONObject();
        out.put("title", title == null ? "" : title);
        out.put("lookback", days);
        out.put("exclude_dominant", excludeDominant);
        out.put("count", rows.size());
        out.put("rows", json.history(rows));
        return out;
    }

    public JSONObject ledger(String order, boolean runBackfill) throws IOException {
        boolean ascending = isAscending(order);
        LedgerListing listing = ledger.list(ascending, runBackfill);
        JSONArray records = new JSONArray();
        for (LedgerRecord record : listing.records) {
            records.put(json.record(record));
        }
        JSONArray columns = new JSONArray();
        for (LedgerColumn column : LedgerColumn.values()) {
            columns.put(column.key());
        }
        JSONObject out = new JSONObject();
        out.put("ok", true);
        out.put("columns", columns);
        out.put("count", listing.records.size());
        out.put("order", listing.ascending ? "asc" : "desc");
        out.put("fixed", listing.fixed);
        out.put("records", records);
        return out;
    }

    public JSONObject addLedgerRecord(Map<String, ?> payload) throws IOException {
        LedgerRecord written = ledger.append(LedgerRecord.fromPayload(payload));
        JSONObject out = new JSONObject();
        out.put("ok", true);
        out.put("record_path", String.valueOf(ledger.path()));
        out.put("record", json.record(written));
        return out;
    }

    public JSONObject deleteLedgerRecord(String recordId) throws IOException {
        int deleted = ledger.delete(recordId);
        JSONObject out = new JSONObject();
        out.put("ok", true);
        out.put("deleted", deleted);
        return out;
    }

    public TriggerResult triggerRefresh(String token) {
        return refresh.trigger(token);
    }

    public JSONObject refreshResponse(TriggerResult result) {
        JSONObject out = new JSONObject();
        out.put("ok", result.started());
        out.put("status", result.status.name());
        out.put("refresh_id", result.state.refreshId);
        out.put("started_at", result.state.startedAt.isEmpty() ? JSONObject.NULL : result.state.startedAt);
        return out;
    }

    public JSONObject refreshStatus() {
        return json.refresh(refresh.status());
    }

    public RefreshOrchestrator refresh() {
        return refresh;
    }

    /**
     * Blank means the latest day on disk.
     */
    String resolveDay(String date) {
        if (!explicit(date)) {
            return store.latestDay()
                    .orElseThrow(() -> new SnapshotNotFoundException("no snapshot days under " + store.root()));
        }
        String day = date.trim();
        if (!DateCodes.isDayCode(day)) {
            throw new IllegalArgumentException("date must be yymmdd: " + day);
        }
        if (!store.hasDay(day)) {
            throw new SnapshotNotFoundException("no snapshot directory for " + day);
        }
        return day;
    }

    int clamp(Integer requested, String keyPrefix, int floor) {
        int def = config.getInt(keyPrefix + ".default", floor);
        int min = config.getInt(keyPrefix + ".min", floor);
        int max = config.getInt(keyPrefix + ".max", Integer.MAX_VALUE);
        int value = requested == null ? def : requested;
        return Math.max(min, Math.min(value, max));
    }

    private JSONObject header(String day, boolean excludeDominant, String sort) {
        JSONObject out = new JSONObject();
        out.put("date", day);
        out.put("exclude_dominant", excludeDominant);
        out.put("sort", sort);
        return out;
    }

    // Blank request falls back to theme.preview.sort.
    private String effectiveSort(String sort) {
        if (sort != null && !sort.isBlank()) {
            return sort.trim();
        }
        String configured = config.getString("theme.preview.sort", PreviewSort.CHANGE_RATE.key());
        return configured == null || configured.isBlank() ? PreviewSort.CHANGE_RATE.key() : configured.trim();
    }

    private static boolean explicit(String date) {
        return date != null && !date.trim().isEmpty();
    }

    private static boolean isAscending(String order) {
        String v = order == null ? "" : order.trim().toLowerCase(Locale.ROOT);
        return v.equals("asc") || v.equals("up") || v.equals("1") || v.equals("true") || v.equals("yes") || v.equals("y");
    }
}
