package com.themeboard.kr.forward;

import com.themeboard.core.diagnostics.CauseCode;
import com.themeboard.kr.model.BarDaily;

import java.time.LocalDate;
import java.util.Map;

/**
 * 模块说明：ForwardContext（class）。
 * 主要职责：一次请求内共享的基准日/次日及两天的全市场行情，外加 ok/error/warn 状态标记。
 * 使用建议：ok=false 表示无法补全；ok=true 但 next 为空表示次日行情尚未产生。
 */
public final class ForwardContext {
    public final String dayCode;
    public final LocalDate base;
    public final LocalDate next;
    public final Map<String, BarDaily> baseBars;
    public final Map<String, BarDaily> nextBars;
    public final boolean ok;
    public final CauseCode causeCode;
    public final String error;
    public final String warn;

    ForwardContext(
            String dayCode,
            LocalDate base,
            LocalDate next,
            Map<String, BarDaily> baseBars,
            Map<String, BarDaily> nextBars,
            boolean ok,
            CauseCode causeCode,
            String error,
            String warn
    ) {
        this.dayCode = dayCode == null ? "" : dayCode;
        this.base = base;
        this.next = next;
        this.baseBars = baseBars == null ? Map.of() : baseBars;
        this.nextBars = nextBars == null ? Map.of() : nextBars;
        this.ok = ok;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.error = error == null ? "" : error;
        this.warn = warn == null ? "" : warn;
    }

    static ForwardContext failed(String dayCode, LocalDate base, CauseCode cause, String error) {
        return new ForwardContext(dayCode, base, null, Map.of(), Map.of(), false, cause, error, "");
    }

    public boolean canEnrich() {
        return ok && base != null && next != null;
    }
}
