package com.themeboard.kr.ledger;

import com.themeboard.core.diagnostics.Outcome;
import com.themeboard.kr.calendar.TradingCalendarResolver;
import com.themeboard.kr.forward.ForwardReturnJoiner;
import com.themeboard.kr.model.ForwardReturn;
import com.themeboard.utils.DateCodes;
import com.themeboard.utils.InstrumentCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 模块说明：ForwardFieldBackfiller（class）。
 * 主要职责：根据记录的 (日期, 代码) 补全五个次日字段；只填空白字段，绝不覆盖已有值。
 * 处理流程：规范化代码与日期 → 基准交易日（找不到时用原日期）→ 下一交易日 → 单只行情。
 */
public class ForwardFieldBackfiller {
    private static final Logger LOG = LogManager.getLogger(ForwardFieldBackfiller.class);

    private final TradingCalendarResolver calendar;
    private final ForwardReturnJoiner joiner;

    public ForwardFieldBackfiller(TradingCalendarResolver calendar, ForwardReturnJoiner joiner) {
        this.calendar = calendar;
        this.joiner = joiner;
    }

    public LedgerRecord backfill(LedgerRecord record) {
        String rawDate = record.get(LedgerColumn.DATE);
        String rawCode = record.get(LedgerColumn.CODE);
        if (rawDate.isEmpty() || rawCode.isEmpty()) {
            return record;
        }
        String code = InstrumentCodes.normalize(rawCode);
        if (code.isEmpty()) {
            return record;
        }
        LedgerRecord out = record.with(LedgerColumn.CODE, code);

        String compact = rawDate.replace("-", "");
        if (DateCodes.YYYYMMDD.matcher(compact).matches()) {
            out = out.with(LedgerColumn.DATE, DateCodes.toYymmdd(compact));
        } else if (!DateCodes.YYMMDD.matcher(compact).matches()) {
            return out;
        }
        LocalDate day = DateCodes.parseDay(compact);
        if (day == null) {
            return out;
        }
        if (allFilled(out)) {
            return out;
        }

        Optional<LocalDate> resolvedBase = calendar.resolveBase(day);
        if (resolvedBase.isEmpty()) {
            LOG.debug("ledger backfill skipped code={} day={}: no trading day found", code, day);
            return out;
        }
        LocalDate base = resolvedBase.get();
        Optional<LocalDate> next = calendar.resolveNext(base);
        if (next.isEmpty()) {
            return out;
        }
        out = fill(out, LedgerColumn.NEXT_TRADE_DATE, DateCodes.formatDay(next.get()));

        Outcome<ForwardReturn> forward = joiner.forwardFor(code, base, next.get());
        if (!forward.success) {
            LOG.debug("ledger backfill skipped code={} day={} cause={}", code, day, forward.causeCode);
            return out;
        }
        ForwardReturn fr = forward.value;
        out = fill(out, LedgerColumn.NEXT_CLOSE, fr.nextCloseText());
        out = fill(out, LedgerColumn.NEXT_HIGH, fr.nextHighText());
        out = fill(out, LedgerColumn.D1_CLOSE_RATE, fr.closeToCloseText());
        out = fill(out, LedgerColumn.D1_HIGH_RATE, fr.closeToHighText());
        return out;
    }

    private static boolean allFilled(LedgerRecord record) {
        for (LedgerColumn column : LedgerColumn.FORWARD_FIELDS) {
            if (record.isBlank(column)) {
                return false;
            }
        }
        return true;
    }

    private static LedgerRecord fill(LedgerRecord record, LedgerColumn column, String value) {
        if (!record.isBlank(column) || value == null || value.isEmpty()) {
            return record;
        }
        return record.with(column, value);
    }
}
