package com.themeboard.kr.forward;

import com.themeboard.core.diagnostics.CauseCode;
import com.themeboard.core.diagnostics.Outcome;
import com.themeboard.kr.calendar.TradingCalendarResolver;
import com.themeboard.kr.config.Config;
import com.themeboard.kr.data.DailyBarSource;
import com.themeboard.kr.model.BarDaily;
import com.themeboard.kr.model.ForwardReturn;
import com.themeboard.kr.model.InstrumentRow;
import com.themeboard.utils.DateCodes;
import com.themeboard.utils.InstrumentCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 模块说明：ForwardReturnJoiner（class）。
 * 主要职责：为主题行补全“基准日收盘 → 次日收盘/最高”的收益；优先使用全市场批量行情，缺失的代码逐只回退查询。
 * 使用建议：逐只回退结果按 (日期, 代码) 永久缓存；批量结果只保留最近若干天，空结果不缓存。
 */
public class ForwardReturnJoiner {
    private static final Logger LOG = LogManager.getLogger(ForwardReturnJoiner.class);
    private static final DateTimeFormatter KEY_FMT = DateTimeFormatter.BASIC_ISO_DATE;

    private final DailyBarSource source;
    private final TradingCalendarResolver calendar;
    private final int fallbackThreads;
    private final Map<LocalDate, Map<String, BarDaily>> bulkCache;
    private final ConcurrentHashMap<String, BarDaily> singleCache = new ConcurrentHashMap<>();

    public ForwardReturnJoiner(DailyBarSource source, TradingCalendarResolver calendar, Config config) {
        this(
                source,
                calendar,
                config.getInt("forward.fallback.threads", 4),
                config.getInt("forward.bulk.cache_days", 16)
        );
    }

    public ForwardReturnJoiner(DailyBarSource source, TradingCalendarResolver calendar, int fallbackThreads, int bulkCacheDays) {
        this.source = source;
        this.calendar = calendar;
        this.fallbackThreads = Math.max(1, fallbackThreads);
        int capacity = Math.max(1, bulkCacheDays);
        this.bulkCache = new LinkedHashMap<>(capacity + 1, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<LocalDate, Map<String, BarDaily>> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Resolves base and next trading days for a snapshot directory and loads both days' bulk bars.
     */
    public ForwardContext prepare(String dayCode) {
        LocalDate requested = DateCodes.parseDay(dayCode);
        if (requested == null) {
            return ForwardContext.failed(dayCode, null, CauseCode.DATE_UNPARSEABLE, "invalid date: " + dayCode);
        }
        Optional<LocalDate> base = calendar.resolveBase(requested);
        if (base.isEmpty()) {
            return ForwardContext.failed(dayCode, null, CauseCode.NO_TRADING_DAY, "base trading day not found");
        }
        Optional<LocalDate> next = calendar.resolveNext(base.get());
        if (next.isEmpty()) {
            return new ForwardContext(dayCode, base.get(), null, Map.of(), Map.of(), true,
                    CauseCode.NEXT_DAY_PENDING, "", "next trading day not available yet");
        }
        Map<String, BarDaily> baseBars = bulk(base.get());
        Map<String, BarDaily> nextBars = bulk(next.get());
        String warn = "";
        CauseCode cause = CauseCode.NONE;
        if (baseBars.isEmpty() || nextBars.isEmpty()) {
            warn = "bulk prices unavailable; per-instrument fallback";
            cause = CauseCode.BULK_UNAVAILABLE;
        }
        return new ForwardContext(dayCode, base.get(), next.get(), baseBars, nextBars, true, cause, "", warn);
    }

    /**
     * Rows come back in input order; rows that cannot be resolved keep a null forward return.
     */
    public List<InstrumentRow> enrich(List<InstrumentRow> rows, ForwardContext context) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        if (context == null || !context.canEnrich()) {
            return rows;
        }
        Set<String> missing = new LinkedHashSet<>();
        for (InstrumentRow row : rows) {
            String code = InstrumentCodes.normalize(row.code);
            if (code.isEmpty()) {
                continue;
            }
            if (!context.baseBars.containsKey(code)) {
                missing.add(cacheKey(context.base, code));
            }
            if (!context.nextBars.containsKey(code)) {
                missing.add(cacheKey(context.next, code));
            }
        }
        fetchMissing(missing);

        List<InstrumentRow> out = new ArrayList<>(rows.size());
        for (InstrumentRow row : rows) {
            String code = InstrumentCodes.normalize(row.code);
            if (code.isEmpty()) {
                out.add(row);
                continue;
            }
            BarDaily baseBar = lookup(context.baseBars, context.base, code);
            BarDaily nextBar = lookup(context.nextBars, context.next, code);
            ForwardReturn fr = compute(context.next, baseBar, nextBar);
            out.add(fr == null ? row : row.withForwardReturn(fr));
        }
        return out;
    }

    /**
     * Single-instrument variant; bulk data is used only when it is already cached.
     */
    public Outcome<ForwardReturn> forwardFor(String code, LocalDate base, LocalDate next) {
        String normalized = InstrumentCodes.normalize(code);
        if (normalized.isEmpty()) {
            return Outcome.failure(CauseCode.CODE_UNRESOLVED, "forward_joiner");
        }
        if (base == null || next == null) {
            return Outcome.failure(CauseCode.NEXT_DAY_PENDING, "forward_joiner");
        }
        BarDaily baseBar = lookup(cachedBulk(base), base, normalized);
        if (baseBar == null) {
            baseBar = fetchSingle(base, normalized);
        }
        BarDaily nextBar = lookup(cachedBulk(next), next, normalized);
        if (nextBar == null) {
            nextBar = fetchSingle(next, normalized);
        }
        if (baseBar == null || nextBar == null) {
            return Outcome.failure(CauseCode.NO_BARS, "forward_joiner", Map.of("code", normalized));
        }
        ForwardReturn fr = compute(next, baseBar, nextBar);
        if (fr == null) {
            return Outcome.failure(CauseCode.BASE_CLOSE_INVALID, "forward_joiner", Map.of("code", normalized));
        }
        return Outcome.success(fr, "forward_joiner");
    }

    public TradingCalendarResolver calendar() {
        return calendar;
    }

    private static ForwardReturn compute(LocalDate next, BarDaily baseBar, BarDaily nextBar) {
        if (baseBar == null || nextBar == null) {
            return null;
        }
        return ForwardReturn.compute(next, baseBar.close, nextBar.close, nextBar.high);
    }

    private BarDaily lookup(Map<String, BarDaily> bulk, LocalDate day, String code) {
        BarDaily bar = bulk == null ? null : bulk.get(code);
        if (bar != null) {
            return bar;
        }
        return singleCache.get(cacheKey(day, code));
    }

    private Map<String, BarDaily> bulk(LocalDate day) {
        Map<String, BarDaily> cached = cachedBulk(day);
        if (cached != null) {
            return cached;
        }
        Outcome<Map<String, BarDaily>> outcome = source.fetchAllByCode(day);
        if (!outcome.success || outcome.value == null || outcome.value.isEmpty()) {
            LOG.info("bulk bars unavailable day={} cause={}", day, outcome.causeCode);
            return Map.of();
        }
        Map<String, BarDaily> bars = Map.copyOf(outcome.value);
        synchronized (bulkCache) {
            bulkCache.put(day, bars);
        }
        return bars;
    }

    private Map<String, BarDaily> cachedBulk(LocalDate day) {
        synchronized (bulkCache) {
            return bulkCache.get(day);
        }
    }

    private void fetchMissing(Set<String> keys) {
        List<String> pending = new ArrayList<>();
        for (String key : keys) {
            if (!singleCache.containsKey(key)) {
                pending.add(key);
            }
        }
        if (pending.isEmpty()) {
            return;
        }
        int poolSize = Math.max(1, Math.min(fallbackThreads, pending.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<BarDaily> completion = new ExecutorCompletionService<>(pool);
        int submitted = 0;
        try {
            for (String key : pending) {
                LocalDate day = LocalDate.parse(key.substring(0, 8), KEY_FMT);
                String code = key.substring(9);
                completion.submit(() -> fetchSingle(day, code));
                submitted++;
            }
            for (int i = 0; i < submitted; i++) {
                Future<BarDaily> future = completion.take();
                try {
                    future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("forward fallback fetch failed err={}", cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdown();
        }
        LOG.debug("forward fallback fetched {} instrument-days", submitted);
    }

    private BarDaily fetchSingle(LocalDate day, String code) {
        String key = cacheKey(day, code);
        BarDaily cached = singleCache.get(key);
        if (cached != null) {
            return cached;
        }
        Outcome<BarDaily> outcome = source.fetchDay(day, code);
        if (!outcome.success || outcome.value == null || !outcome.value.isOn(day)) {
            return null;
        }
        singleCache.put(key, outcome.value);
        return outcome.value;
    }

    private static String cacheKey(LocalDate day, String code) {
        return KEY_FMT.format(day) + ":" + code;
    }
}
