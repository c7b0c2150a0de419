package com.themeboard.kr.theme;

import com.themeboard.kr.model.InstrumentRow;
import com.themeboard.utils.Numbers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Secondary ordering of a theme's rows for display. All keys sort descending; the sort is stable
 * so equal keys keep file order.
 */
public enum PreviewSort {
    CHANGE_RATE(Set.of("등락률", "change_rate", "changerate", "change", "rate")),
    TRADE_VALUE(Set.of("거래대금", "trade_value", "tradevalue", "trade", "value")),
    VOLUME(Set.of("거래량", "volume")),
    FILE_ORDER(Set.of());

    private static final double MISSING_RATE = -1e18;
    private static final double MISSING_AMOUNT = -1.0;

    private final Set<String> aliases;

    PreviewSort(Set<String> aliases) {
        this.aliases = aliases;
    }

    /**
     * Blank means change-rate; anything unrecognised keeps file order.
     */
    public static PreviewSort parse(String raw) {
        String key = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return CHANGE_RATE;
        }
        for (PreviewSort sort : values()) {
            if (sort.aliases.contains(key)) {
                return sort;
            }
        }
        return FILE_ORDER;
    }

    public List<InstrumentRow> sort(List<InstrumentRow> rows, boolean tradeValueInMillions) {
        List<InstrumentRow> out = new ArrayList<>(rows);
        ToDoubleFunction<InstrumentRow> key;
        switch (this) {
            case CHANGE_RATE:
                key = PreviewSort::changeRateKey;
                break;
            case TRADE_VALUE:
                key = row -> {
                    Double v = Numbers.parsePlain(row.tradeValue);
                    if (v == null) {
                        return MISSING_AMOUNT;
                    }
                    return tradeValueInMillions ? v * 1_000_000.0 : v;
                };
                break;
            case VOLUME:
                key = row -> {
                    Double v = Numbers.parsePlain(row.volume);
                    return v == null ? MISSING_AMOUNT : v;
                };
                break;
            default:
                return out;
        }
        out.sort(Comparator.comparingDouble(key).reversed());
        return out;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT).replace("_", "");
    }

    private static double changeRateKey(InstrumentRow row) {
        String cleaned = row.changeRate.replace("%", "").replace("+", "");
        Double v = Numbers.parsePlain(cleaned);
        return v == null ? MISSING_RATE : v;
    }
}
