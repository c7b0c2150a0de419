package com.themeboard.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {
    /** Empty means {@code <theme.root>/record.csv}. */
    private String path = "";
    private boolean backfillOnAppend = true;
}
