package com.themeboard.kr.ledger;

public enum MigrationOutcome {
    /** No file, or an empty one. */
    ABSENT,
    CURRENT,
    MIGRATED,
    /** Header is not a subset of the schema; file left as-is. */
    FOREIGN
}
