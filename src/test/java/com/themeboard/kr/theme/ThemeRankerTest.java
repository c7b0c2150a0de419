package com.themeboard.kr.theme;

import com.themeboard.kr.model.RankedTheme;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThemeRankerTest {

    @TempDir
    Path root;

    private ThemeRanker ranker;

    @BeforeEach
    void setUp() {
        ThemeSnapshotStore store = new ThemeSnapshotStore(root, true, List.of("00_"));
        ranker = new ThemeRanker(store, new DominantInstrumentFilter(List.of("MegaCorp"), List.of()));
    }

    private static List<String> titles(List<RankedTheme> themes) {
        List<String> out = new ArrayList<>();
        for (RankedTheme t : themes) {
            out.add(t.title);
        }
        return out;
    }

    @Test
    void rankThemes_shouldBreakTradeSumTiesByTitle() throws Exception {
        ThemeFixtures.writeTheme(root, "240105", "1.Batteries_500.csv", "b1,000001,1,+1%,300,1", "b2,000002,1,+2%,200,1");
        ThemeFixtures.writeTheme(root, "240105", "2.Autos_500.csv", "a1,000003,1,+1%,500,1");
        ThemeFixtures.writeTheme(root, "240105", "3.Chips_900.csv", "c1,000004,1,+1%,900,1");

        List<RankedTheme> ranked = ranker.rankThemes("240105", false);

        assertEquals(List.of("Chips", "Autos", "Batteries"), titles(ranked));
        assertEquals(1, ranked.get(0).rank);
        assertEquals(900L, ranked.get(0).tradeSum);
        assertEquals(3, ranked.get(2).rank);
        assertTrue(ranked.get(0).preview.isEmpty());
    }

    @Test
    void rankThemes_excludeDominantShouldAffectRowsAndRanking() throws Exception {
        ThemeFixtures.writeTheme(root, "240105", "1.Giants_1010.csv",
                "MegaCorp,000010,1,+1%,1000,1", "Small,000011,1,+9%,10,1");
        ThemeFixtures.writeTheme(root, "240105", "2.Mid_300.csv", "MidCo,000012,1,+2%,300,1");

        List<RankedTheme> included = ranker.rankThemes("240105", false, PreviewSort.CHANGE_RATE, 10, 5);
        List<RankedTheme> excluded = ranker.rankThemes("240105", true, PreviewSort.CHANGE_RATE, 10, 5);

        assertEquals(List.of("Giants", "Mid"), titles(included));
        assertEquals(1010L, included.get(0).tradeSum);
        assertEquals(List.of("Mid", "Giants"), titles(excluded));
        assertEquals(10L, excluded.get(1).tradeSum);
        assertEquals(1, excluded.get(1).preview.size());
        assertEquals("Small", excluded.get(1).preview.get(0).name);
    }

    @Test
    void rankThemes_shouldApplyLimitAndPreviewSize() throws Exception {
        ThemeFixtures.writeTheme(root, "240105", "1.A_3.csv", "x,000001,1,+1%,1,1", "y,000002,1,+3%,1,1", "z,000003,1,+2%,1,1");
        ThemeFixtures.writeTheme(root, "240105", "2.B_1.csv", "w,000004,1,+1%,1,1");

        List<RankedTheme> ranked = ranker.rankThemes("240105", false, PreviewSort.CHANGE_RATE, 1, 2);

        assertEquals(1, ranked.size());
        assertEquals("A", ranked.get(0).title);
        assertEquals(2, ranked.get(0).preview.size());
        assertEquals("y", ranked.get(0).preview.get(0).name);
        assertEquals("z", ranked.get(0).preview.get(1).name);
    }

    @Test
    void rankThemes_shouldBeIdempotent() throws Exception {
        ThemeFixtures.writeTheme(root, "240105", "1.A_3.csv", "x,000001,1,+1%,3,1");
        ThemeFixtures.writeTheme(root, "240105", "2.B_5.csv", "y,000002,1,+1%,5,1");

        List<RankedTheme> first = ranker.rankThemes("240105", true);
        List<RankedTheme> second = ranker.rankThemes("240105", true);

        assertEquals(titles(first), titles(second));
        assertEquals(first.get(0).tradeSum, second.get(0).tradeSum);
    }

    @Test
    void themeAt_shouldReturnAllRowsOrEmptyOutOfRange() throws Exception {
        ThemeFixtures.writeTheme(root, "240105", "1.A_3.csv", "x,000001,1,+1%,1,1", "y,000002,1,+3%,1,1", "z,000003,1,+2%,1,1");

        Optional<RankedTheme> theme = ranker.themeAt("240105", 1, false, PreviewSort.FILE_ORDER);

        assertTrue(theme.isPresent());
        assertEquals(3, theme.get().preview.size());
        assertEquals("x", theme.get().preview.get(0).name);
        assertTrue(ranker.themeAt("240105", 2, false, PreviewSort.FILE_ORDER).isEmpty());
        assertTrue(ranker.themeAt("240105", 0, false, PreviewSort.FILE_ORDER).isEmpty());
    }

    @Test
    void rankThemes_missingDayShouldBeEmpty() {
        assertTrue(ranker.rankThemes("991231", false).isEmpty());
    }
}
