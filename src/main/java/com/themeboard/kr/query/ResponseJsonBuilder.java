package com.themeboard.kr.query;

import com.themeboard.kr.forward.ForwardContext;
import com.themeboard.kr.insight.HotTheme;
import com.themeboard.kr.insight.InsightSummary;
import com.themeboard.kr.insight.RisingTheme;
import com.themeboard.kr.insight.ThemeHistoryEntry;
import com.themeboard.kr.ledger.LedgerRecord;
import com.themeboard.kr.model.ForwardReturn;
import com.themeboard.kr.model.InstrumentRow;
import com.themeboard.kr.model.RankedTheme;
import com.themeboard.kr.refresh.RefreshResult;
import com.themeboard.kr.refresh.RefreshState;
import com.themeboard.utils.DateCodes;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * 模块说明：ResponseJsonBuilder（class）。
 * 主要职责：把查询结果转换成对外 JSON；字段名保持 snake_case。
 */
public final class ResponseJsonBuilder {

    public JSONObject row(InstrumentRow row) {
        JSONObject o = new JSONObject();
        o.put("name", row.name);
        o.put("code", row.code);
        o.put("change_rate", row.changeRate);
        o.put("price", row.price);
        o.put("trade_value", row.tradeValue);
        o.put("volume", row.volume);
        o.put("market_cap", row.marketCap);
        o.put("chart_url", row.chartUrl);
        o.put("raw", new JSONObject(row.raw));
        ForwardReturn fr = row.forwardReturn;
        if (fr != null) {
            o.put("d1_next_trade_date", DateCodes.formatDay(fr.nextTradeDate));
            o.put("d1_close_rate", fr.closeToCloseText());
            o.put("d1_high_rate", fr.closeToHighText());
            o.put("d1_next_close", fr.nextCloseText());
            o.put("d1_next_high", fr.nextHighText());
        }
        return o;
    }

    public JSONArray rows(List<InstrumentRow> rows) {
        JSONArray arr = new JSONArray();
        for (InstrumentRow row : rows) {
            arr.put(row(row));
        }
        return arr;
    }

    public JSONObject theme(RankedTheme theme, List<InstrumentRow> rows, String rowsKey) {
        JSONObject o = new JSONObject();
        o.put("rank", theme.rank);
        o.put("title", theme.title);
        o.put("trade_sum", theme.tradeSum);
        o.put("filename", theme.filename);
        o.put(rowsKey, rows(rows));
        return o;
    }

    /**
     * Without a context (latest-day queries) the block reports ok=false and no error.
     */
    public JSONObject forward(ForwardContext ctx) {
        JSONObject o = new JSONObject();
        if (ctx == null) {
            o.put("ok", false);
            o.put("error", JSONObject.NULL);
            o.put("warn", JSONObject.NULL);
            o.put("base_trade_date", JSONObject.NULL);
            o.put("next_trade_date", JSONObject.NULL);
            return o;
        }
        o.put("ok", ctx.ok);
        o.put("cause", ctx.causeCode.name());
        o.put("error", nullIfEmpty(ctx.error));
        o.put("warn", nullIfEmpty(ctx.warn));
        o.put("base_trade_date", ctx.base == null ? JSONObject.NULL : DateCodes.formatDay(ctx.base));
        o.put("next_trade_date", ctx.next == null ? (ctx.ok ? "" : JSONObject.NULL) : DateCodes.formatDay(ctx.next));
        return o;
    }

    public JSONObject insights(InsightSummary summary) {
        JSONObject o = new JSONObject();
        o.put("lookback", summary.lookbackDays);
        o.put("top_n", summary.topN);
        o.put("exclude_dominant", summary.excludeDominant);
        o.put("dates", new JSONArray(summary.dates));
        JSONArray hottest = new JSONArray();
        for (HotTheme h : summary.hottest) {
            JSONObject item = new JSONObject();
            item.put("title", h.title);
            item.put("freq", h.frequency);
            item.put("avg_rank", h.avgRank);
            item.put("avg_trade_sum", h.avgTradeSum);
            item.put("momentum_score", h.momentumScore);
            item.put("last_seen", h.lastSeen);
            item.put("last_rank", h.lastRank);
            hottest.put(item);
        }
        o.put("hottest", hottest);
        JSONArray rising = new JSONArray();
        for (RisingTheme r : summary.rising) {
            JSONObject item = new JSONObject();
            item.put("title", r.title);
            item.put("improvement", r.improvement);
            item.put("prev_avg_rank", r.olderAvgRank);
            item.put("recent_avg_rank", r.newerAvgRank);
            item.put("recent_freq", r.newerFrequency);
            rising.put(item);
        }
        o.put("rising", rising);
        return o;
    }

    public JSONArray history(List<ThemeHistoryEntry> entries) {
        JSONArray arr = new JSONArray();
        for (ThemeHistoryEntry e : entries) {
            JSONObject item = new JSONObject();
            item.put("date", e.dayCode);
            item.put("title", e.title);
            item.put("rank", e.rank);
            item.put("trade_sum", e.tradeSum);
            item.put("filename", e.filename);
            arr.put(item);
        }
        return arr;
    }

    public JSONObject record(LedgerRecord record) {
        return new JSONObject(record.toPayload());
    }

    public JSONObject refresh(RefreshState state) {
        JSONObject o = new JSONObject();
        o.put("in_progress", state.inProgress);
        o.put("started_at", nullIfEmpty(state.startedAt));
        o.put("ended_at", nullIfEmpty(state.endedAt));
        o.put("last_result", result(state.lastResult));
        o.put("last_error", nullIfEmpty(state.lastError));
        o.put("refresh_id", state.refreshId);
        return o;
    }

    private Object result(RefreshResult result) {
        if (result == null) {
            return JSONObject.NULL;
        }
        JSONObject o = new JSONObject();
        o.put("date_tag", result.dateTag);
        o.put("out_dir", result.outDir);
        o.put("seconds", result.seconds);
        o.put("files", result.files);
        return o;
    }

    private static Object nullIfEmpty(String value) {
        return value == null || value.isEmpty() ? JSONObject.NULL : value;
    }
}
