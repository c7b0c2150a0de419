package com.themeboard.kr.theme;

import com.themeboard.kr.config.Config;
import com.themeboard.kr.model.InstrumentRow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deny-list of oversized instruments: exact names plus name prefixes.
 */
public final class DominantInstrumentFilter {
    private final Set<String> exactNames;
    private final List<String> prefixes;

    public DominantInstrumentFilter(Config config) {
        this(config.getList("theme.dominant.names"), config.getList("theme.dominant.prefixes"));
    }

    public DominantInstrumentFilter(List<String> exactNames, List<String> prefixes) {
        this.exactNames = new LinkedHashSet<>(exactNames == null ? List.of() : exactNames);
        this.prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
    }

    public boolean isDominant(String name) {
        String n = name == null ? "" : name.trim();
        if (n.isEmpty()) {
            return false;
        }
        if (exactNames.contains(n)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (n.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public List<InstrumentRow> filter(List<InstrumentRow> rows) {
        List<InstrumentRow> out = new ArrayList<>(rows.size());
        for (InstrumentRow row : rows) {
            if (!isDominant(row.name)) {
                out.add(row);
            }
        }
        return out;
    }
}
