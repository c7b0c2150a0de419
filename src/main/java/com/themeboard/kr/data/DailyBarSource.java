package com.themeboard.kr.data;

import com.themeboard.core.diagnostics.Outcome;
import com.themeboard.kr.model.BarDaily;

import java.time.LocalDate;
import java.util.Map;

/**
 * Daily-bar price source. Implementations never throw for missing data; they report it through
 * {@link Outcome} so callers can tell "no bar" from "source broken".
 */
public interface DailyBarSource {

    /**
     * Single instrument, single day. The returned bar's {@code tradeDate} is whatever the source
     * reported; some sources substitute the nearest trading day, so callers that need an exact day
     * must compare it themselves.
     */
    Outcome<BarDaily> fetchDay(LocalDate day, String code);

    /**
     * Whole tradable universe for one day, keyed by normalized 6-digit code.
     */
    Outcome<Map<String, BarDaily>> fetchAllByCode(LocalDate day);
}
