package com.themeboard.kr.ledger;

import java.util.ArrayList;
import java.util.List;

/**
 * record.csv schema, in file order. The header text is Korean; payload keys are English.
 */
public enum LedgerColumn {
    RECORD_ID("기록ID", "record_id"),
    SAVED_AT("기록시각", "saved_at"),
    DATE("날짜", "date"),
    THEME_TITLE("테마명", "theme_title"),
    THEME_RANK("테마랭크", "theme_rank"),
    THEME_FILENAME("테마파일", "theme_filename"),
    CHART_URL("차트링크", "chart_url"),
    NAME("종목명", "name"),
    CODE("종목코드", "code"),
    MARKET_CAP("시가총액", "market_cap"),
    TRADE_VALUE("거래대금", "trade_value"),
    CHANGE_RATE("등락률", "change_rate"),
    ALPHA("알파값", "alpha"),
    BETA("베타값", "beta"),
    NEXT_TRADE_DATE("익일거래일", "next_trade_date"),
    NEXT_CLOSE("익일종가", "next_close"),
    NEXT_HIGH("익일고가", "next_high"),
    D1_CLOSE_RATE("익일종가수익률", "d1_close_rate"),
    D1_HIGH_RATE("익일고가수익률", "d1_high_rate");

    public static final List<LedgerColumn> FORWARD_FIELDS = List.of(
            NEXT_TRADE_DATE, NEXT_CLOSE, NEXT_HIGH, D1_CLOSE_RATE, D1_HIGH_RATE
    );

    private final String header;
    private final String key;

    LedgerColumn(String header, String key) {
        this.header = header;
        this.key = key;
    }

    public String header() {
        return header;
    }

    public String key() {
        return key;
    }

    public static LedgerColumn fromHeader(String header) {
        String h = header == null ? "" : header.trim();
        for (LedgerColumn column : values()) {
            if (column.header.equals(h)) {
                return column;
            }
        }
        return null;
    }

    public static String[] headerRow() {
        List<String> out = new ArrayList<>();
        for (LedgerColumn column : values()) {
            out.add(column.header);
        }
        return out.toArray(new String[0]);
    }
}
