package com.themeboard.kr.model;

import java.time.LocalDate;

/**
 * 模块说明：BarDaily（class）。
 * 主要职责：单个交易日的 OHLCV 行情，tradeDate 为行情源实际返回的日期。
 */
public final class BarDaily {
    public final String code;
    public final LocalDate tradeDate;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public BarDaily(String code, LocalDate tradeDate, double open, double high, double low, double close, double volume) {
        this.code = code;
        this.tradeDate = tradeDate;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public boolean isOn(LocalDate day) {
        return day != null && day.equals(tradeDate);
    }
}
