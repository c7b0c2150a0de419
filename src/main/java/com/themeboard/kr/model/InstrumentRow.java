package com.themeboard.kr.model;

import com.themeboard.utils.Numbers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模块说明：InstrumentRow（class）。
 * 主要职责：主题 CSV 中的一行。展示字段保持原始文本，数值字段只用于排序与汇总。
 * 使用建议：code 为空的行无法补全次日收益。
 */
public final class InstrumentRow {
    public final String name;
    public final String code;
    public final String changeRate;
    public final String price;
    public final String tradeValue;
    public final String volume;
    public final String marketCap;
    public final String chartUrl;
    public final Map<String, String> raw;
    public final ForwardReturn forwardReturn;

    public InstrumentRow(
            String name,
            String code,
            String changeRate,
            String price,
            String tradeValue,
            String volume,
            String marketCap,
            String chartUrl,
            Map<String, String> raw,
            ForwardReturn forwardReturn
    ) {
        this.name = safe(name);
        this.code = safe(code);
        this.changeRate = safe(changeRate);
        this.price = safe(price);
        this.tradeValue = safe(tradeValue);
        this.volume = safe(volume);
        this.marketCap = safe(marketCap);
        this.chartUrl = safe(chartUrl);
        this.raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        this.forwardReturn = forwardReturn;
    }

    public InstrumentRow withForwardReturn(ForwardReturn value) {
        return new InstrumentRow(name, code, changeRate, price, tradeValue, volume, marketCap, chartUrl, raw, value);
    }

    public boolean hasCode() {
        return !code.isEmpty();
    }

    public Double changeRateValue() {
        return Numbers.parse(changeRate);
    }

    public Double tradeValueNumber() {
        return Numbers.parsePlain(tradeValue);
    }

    public Double volumeNumber() {
        return Numbers.parsePlain(volume);
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
