package com.themeboard.kr.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    private final Path workingDir = Path.of("/tmp/themeboard-work");

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMaps() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of(
                "theme", Map.of("root", "data/tema", "cache", Map.of("enabled", "false")),
                "calendar", Map.of("scan_days", 30)
        ));

        assertEquals(workingDir.resolve("data/tema"), config.getPath("theme.root"));
        assertFalse(config.getBoolean("theme.cache.enabled", true));
        assertEquals(30, config.getInt("calendar.scan_days", 60));
    }

    @Test
    void lists_shouldJoinAndSplitOnCommas() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of(
                "theme", Map.of("dominant", Map.of("names", List.of("SK하이닉스", "LG에너지솔루션")))
        ));

        assertEquals(List.of("SK하이닉스", "LG에너지솔루션"), config.getList("theme.dominant.names"));
    }

    @Test
    void blankValues_shouldFallBackToDefaults() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of(
                "theme", Map.of("root", "  ")
        ));

        assertEquals(workingDir.resolve("tema"), config.getPath("theme.root"));
        assertEquals("005930", config.getString("calendar.reference_code"));
        assertEquals(List.of("00_", "00."), config.getList("theme.housekeeping_prefixes"));
        assertTrue(config.getBoolean("app.log_routing", false));
        assertEquals(7, config.getInt("missing.key", 7));
    }

    @Test
    void defaults_shouldCarryQueryBounds() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of());

        assertEquals(20, config.getInt("query.insights.lookback.default", 0));
        assertEquals(5, config.getInt("query.insights.lookback.min", 0));
        assertEquals(120, config.getInt("query.insights.lookback.max", 0));
        assertEquals(240, config.getInt("query.history.lookback.max", 0));
    }
}
