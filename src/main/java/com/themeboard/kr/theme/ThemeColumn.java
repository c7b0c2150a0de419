package com.themeboard.kr.theme;

import java.util.List;

/**
 * Canonical theme CSV columns. Aliases are exact header texts, Korean first.
 */
public enum ThemeColumn {
    NAME(List.of("종목명", "name")),
    CODE(List.of("종목코드", "code")),
    CHANGE_RATE(List.of("등락률", "등락률(%)", "change_rate")),
    TRADE_VALUE(List.of("거래대금", "거래대금(백만)", "trade_value")),
    VOLUME(List.of("거래량", "거래량(주)", "volume")),
    PRICE(List.of("현재가", "price")),
    MARKET_CAP(List.of("시가총액", "market_cap")),
    CHART_URL(List.of("차트링크", "chart_url"));

    private final List<String> aliases;

    ThemeColumn(List<String> aliases) {
        this.aliases = aliases;
    }

    public List<String> aliases() {
        return aliases;
    }
}
