package com.themeboard.kr.ledger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模块说明：LedgerRecord（class）。
 * 主要职责：record.csv 中的一行，全部字段按原文保存为字符串；缺失字段为空串。
 * 使用建议：with 返回新对象，原对象不变。
 */
public final class LedgerRecord {
    private final Map<LedgerColumn, String> values;

    private LedgerRecord(Map<LedgerColumn, String> values) {
        EnumMap<LedgerColumn, String> copy = new EnumMap<>(LedgerColumn.class);
        for (LedgerColumn column : LedgerColumn.values()) {
            String v = values == null ? null : values.get(column);
            copy.put(column, v == null ? "" : v.trim());
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static LedgerRecord empty() {
        return new LedgerRecord(Map.of());
    }

    public static LedgerRecord of(Map<LedgerColumn, String> values) {
        return new LedgerRecord(values);
    }

    /**
     * Builds a record from English payload keys; unknown keys are ignored.
     */
    public static LedgerRecord fromPayload(Map<String, ?> payload) {
        Map<LedgerColumn, String> values = new EnumMap<>(LedgerColumn.class);
        if (payload != null) {
            for (LedgerColumn column : LedgerColumn.values()) {
                Object v = payload.get(column.key());
                if (v != null) {
                    values.put(column, String.valueOf(v));
                }
            }
        }
        return new LedgerRecord(values);
    }

    public String get(LedgerColumn column) {
        return values.get(column);
    }

    public boolean isBlank(LedgerColumn column) {
        return values.get(column).isEmpty();
    }

    public LedgerRecord with(LedgerColumn column, String value) {
        EnumMap<LedgerColumn, String> next = new EnumMap<>(values);
        next.put(column, value);
        return new LedgerRecord(next);
    }

    public Map<String, String> toPayload() {
        Map<String, String> out = new LinkedHashMap<>();
        for (LedgerColumn column : LedgerColumn.values()) {
            out.put(column.key(), values.get(column));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LedgerRecord)) {
            return false;
        }
        return values.equals(((LedgerRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "LedgerRecord" + toPayload();
    }
}
