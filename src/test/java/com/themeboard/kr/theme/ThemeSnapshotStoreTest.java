package com.themeboard.kr.theme;

import com.themeboard.kr.model.InstrumentRow;
import com.themeboard.kr.model.ThemeSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThemeSnapshotStoreTest {

    @TempDir
    Path root;

    private ThemeSnapshotStore store(boolean cache) {
        return new ThemeSnapshotStore(root, cache, List.of("00_", "00."));
    }

    @Test
    void listDays_shouldOnlyReturnSixDigitDirectoriesAscending() throws Exception {
        Files.createDirectories(root.resolve("240108"));
        Files.createDirectories(root.resolve("240105"));
        Files.createDirectories(root.resolve("misc"));
        Files.createDirectories(root.resolve("20240105"));
        Files.writeString(root.resolve("240109"), "not a dir");

        ThemeSnapshotStore store = store(true);

        assertEquals(List.of("240105", "240108"), store.listDays());
        assertEquals(Optional.of("240108"), store.latestDay());
        assertTrue(store.hasDay("240105"));
        assertFalse(store.hasDay("240109"));
    }

    @Test
    void latestDay_shouldBeEmptyWhenRootMissing() {
        ThemeSnapshotStore store = new ThemeSnapshotStore(root.resolve("absent"), true, List.of());

        assertTrue(store.listDays().isEmpty());
        assertTrue(store.latestDay().isEmpty());
    }

    @Test
    void listThemeFiles_shouldSkipHousekeepingFiles() throws Exception {
        ThemeFixtures.writeTheme(root, "240105", "2.Autos_500.csv", "현대차,005380,200000,+1.0%,500,10");
        ThemeFixtures.writeTheme(root, "240105", "1.Batteries_500.csv", "에코프로,086520,600000,+3.0%,500,10");
        ThemeFixtures.writeTheme(root, "240105", "00_summary.csv", "x,1,1,1,1,1");
        Files.writeString(root.resolve("240105").resolve("00_crawler.log"), "log");

        assertEquals(List.of("1.Batteries_500.csv", "2.Autos_500.csv"), store(true).listThemeFiles("240105"));
    }

    @Test
    void read_shouldParseRowsWithBomAndNormalizeCodes() throws Exception {
        Path dir = Files.createDirectories(root.resolve("240105"));
        String body = "\uFEFF종목명,종목코드,현재가,등락률,거래대금(백만),거래량\n"
                + "삼성전자,05930.0,70000,+1.50%,\"1,200\",100\n"
                + ",,,,,\n"
                + "이상한행,A000660,120000,-0.5%,N/A,5\n";
        Files.writeString(dir.resolve("1.반도체_1200.csv"), body, StandardCharsets.UTF_8);

        ThemeSnapshot snapshot = store(true).read("240105", "1.반도체_1200.csv");

        assertEquals("반도체", snapshot.title);
        assertTrue(snapshot.tradeValueInMillions);
        assertEquals(2, snapshot.rows.size());
        InstrumentRow first = snapshot.rows.get(0);
        assertEquals("삼성전자", first.name);
        assertEquals("005930", first.code);
        assertEquals("1,200", first.tradeValue);
        assertEquals("70000", first.raw.get("현재가"));
        assertEquals("000660", snapshot.rows.get(1).code);
        assertEquals(1, snapshot.malformedCells);
    }

    @Test
    void read_shouldReuseCachedSnapshotUntilFileChanges() throws Exception {
        Path file = ThemeFixtures.writeTheme(root, "240105", "1.A_1.csv", "a,000001,1,1,1,1");
        ThemeSnapshotStore store = store(true);

        ThemeSnapshot first = store.read("240105", "1.A_1.csv");
        assertSame(first, store.read("240105", "1.A_1.csv"));
        assertEquals(1, store.cachedEntries());

        Files.writeString(file, ThemeFixtures.HEADER + "\na,000001,1,1,1,1\nb,000002,2,2,2,2\n");
        ThemeSnapshot changed = store.read("240105", "1.A_1.csv");
        assertNotSame(first, changed);
        assertEquals(2, changed.rows.size());

        store.invalidateAll();
        assertEquals(0, store.cachedEntries());
    }

    @Test
    void read_withoutCacheShouldParseEveryTime() throws Exception {
        ThemeFixtures.writeTheme(root, "240105", "1.A_1.csv", "a,000001,1,1,1,1");
        ThemeSnapshotStore store = store(false);

        assertNotSame(store.read("240105", "1.A_1.csv"), store.read("240105", "1.A_1.csv"));
        assertEquals(0, store.cachedEntries());
    }
}
