package com.themeboard.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：区分“数据暂不可用”的具体原因，供调用方决定如何展示，而不是抛出异常。
 */
public enum CauseCode {
    NONE,
    NO_BARS,
    DATE_MISMATCH,
    FETCH_FAILED,
    BULK_UNAVAILABLE,
    NO_TRADING_DAY,
    NEXT_DAY_PENDING,
    BASE_CLOSE_INVALID,
    CODE_UNRESOLVED,
    DATE_UNPARSEABLE,
    RUNTIME_ERROR
}
