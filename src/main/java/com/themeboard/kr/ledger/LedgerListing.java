package com.themeboard.kr.ledger;

import java.util.List;

public final class LedgerListing {
    public final List<LedgerRecord> records;
    public final boolean ascending;
    public final int fixed;

    public LedgerListing(List<LedgerRecord> records, boolean ascending, int fixed) {
        this.records = records == null ? List.of() : List.copyOf(records);
        this.ascending = ascending;
        this.fixed = Math.max(0, fixed);
    }
}
