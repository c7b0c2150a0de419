package com.themeboard.kr.calendar;

import com.themeboard.core.diagnostics.Outcome;
import com.themeboard.kr.config.Config;
import com.themeboard.kr.data.DailyBarSource;
import com.themeboard.kr.model.BarDaily;
import com.themeboard.utils.InstrumentCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模块说明：TradingCalendarResolver（class）。
 * 主要职责：通过对参考标的逐日探测，确定基准交易日与下一交易日。
 * 使用建议：只缓存已解析的结果；未找到的下一交易日可能在之后出现。
 */
public class TradingCalendarResolver {
    private static final Logger LOG = LogManager.getLogger(TradingCalendarResolver.class);

    private final DailyBarSource source;
    private final String referenceCode;
    private final int scanDays;
    private final ConcurrentHashMap<LocalDate, LocalDate> baseCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<LocalDate, LocalDate> nextCache = new ConcurrentHashMap<>();

    public TradingCalendarResolver(DailyBarSource source, Config config) {
        this(
                source,
                config.getString("calendar.reference_code", "005930"),
                config.getInt("calendar.scan_days", 60)
        );
    }

    public TradingCalendarResolver(DailyBarSource source, String referenceCode, int scanDays) {
        this.source = source;
        String normalized = InstrumentCodes.normalize(referenceCode);
        this.referenceCode = normalized.isEmpty() ? "005930" : normalized;
        this.scanDays = Math.max(1, scanDays);
    }

    /**
     * Latest trading day on or before {@code day}, within the scan window.
     */
    public Optional<LocalDate> resolveBase(LocalDate day) {
        if (day == null) {
            return Optional.empty();
        }
        LocalDate cached = baseCache.get(day);
        if (cached != null) {
            return Optional.of(cached);
        }
        for (int i = 0; i < scanDays; i++) {
            LocalDate probe = day.minusDays(i);
            if (isTradingDay(probe)) {
                baseCache.put(day, probe);
                return Optional.of(probe);
            }
        }
        LOG.warn("no trading day found within {} days before {} (reference={})", scanDays, day, referenceCode);
        return Optional.empty();
    }

    /**
     * First trading day strictly after {@code tradingDay}, within the scan window.
     */
    public Optional<LocalDate> resolveNext(LocalDate tradingDay) {
        if (tradingDay == null) {
            return Optional.empty();
        }
        LocalDate cached = nextCache.get(tradingDay);
        if (cached != null) {
            return Optional.of(cached);
        }
        for (int i = 1; i <= scanDays; i++) {
            LocalDate probe = tradingDay.plusDays(i);
            if (isTradingDay(probe)) {
                nextCache.put(tradingDay, probe);
                return Optional.of(probe);
            }
        }
        LOG.debug("next trading day after {} not available yet", tradingDay);
        return Optional.empty();
    }

    public String referenceCode() {
        return referenceCode;
    }

    /**
     * A probe only counts when the returned bar is dated exactly on the probed day; sources that
     * fall back to the nearest session are not trusted.
     */
    private boolean isTradingDay(LocalDate probe) {
        Outcome<BarDaily> outcome = source.fetchDay(probe, referenceCode);
        return outcome.success && outcome.value != null && outcome.value.isOn(probe);
    }
}
