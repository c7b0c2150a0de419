package com.themeboard.kr.model;

import com.themeboard.utils.Numbers;

import java.time.LocalDate;

/**
 * Next-trading-day outcome of one instrument relative to the base day's close.
 */
public final class ForwardReturn {
    public final LocalDate nextTradeDate;
    public final double baseClose;
    public final double nextClose;
    public final double nextHigh;
    public final double closeToClosePct;
    public final double closeToHighPct;

    private ForwardReturn(LocalDate nextTradeDate, double baseClose, double nextClose, double nextHigh) {
        this.nextTradeDate = nextTradeDate;
        this.baseClose = baseClose;
        this.nextClose = nextClose;
        this.nextHigh = nextHigh;
        this.closeToClosePct = (nextClose - baseClose) / baseClose * 100.0;
        this.closeToHighPct = (nextHigh - baseClose) / baseClose * 100.0;
    }

    /**
     * Returns null when the inputs cannot produce a meaningful return (missing or non-positive base
     * close, missing next values).
     */
    public static ForwardReturn compute(LocalDate nextTradeDate, Double baseClose, Double nextClose, Double nextHigh) {
        if (baseClose == null || !(baseClose > 0.0) || nextClose == null || nextHigh == null) {
            return null;
        }
        if (!Double.isFinite(nextClose) || !Double.isFinite(nextHigh)) {
            return null;
        }
        return new ForwardReturn(nextTradeDate, baseClose, nextClose, nextHigh);
    }

    public String closeToCloseText() {
        return Numbers.formatPct(closeToClosePct);
    }

    public String closeToHighText() {
        return Numbers.formatPct(closeToHighPct);
    }

    public String nextCloseText() {
        return Numbers.formatPrice(nextClose);
    }

    public String nextHighText() {
        return Numbers.formatPrice(nextHigh);
    }
}
