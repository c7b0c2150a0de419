package com.themeboard.kr.theme;

import com.themeboard.kr.model.InstrumentRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PreviewSortTest {

    private static InstrumentRow row(String name, String rate, String tradeValue, String volume) {
        return new InstrumentRow(name, "", rate, "", tradeValue, volume, "", "", null, null);
    }

    private static List<String> names(List<InstrumentRow> rows) {
        List<String> out = new ArrayList<>();
        for (InstrumentRow r : rows) {
            out.add(r.name);
        }
        return out;
    }

    @Test
    void parse_shouldDefaultToChangeRateAndKeepFileOrderForUnknown() {
        assertEquals(PreviewSort.CHANGE_RATE, PreviewSort.parse(null));
        assertEquals(PreviewSort.CHANGE_RATE, PreviewSort.parse(" "));
        assertEquals(PreviewSort.TRADE_VALUE, PreviewSort.parse("거래대금"));
        assertEquals(PreviewSort.VOLUME, PreviewSort.parse("VOLUME"));
        assertEquals(PreviewSort.FILE_ORDER, PreviewSort.parse("alphabetical"));
        assertEquals("changerate", PreviewSort.CHANGE_RATE.key());
    }

    @Test
    void sort_changeRateShouldPutMissingLast() {
        List<InstrumentRow> rows = List.of(
                row("a", "+5.0%", "", ""),
                row("b", "", "", ""),
                row("c", "12.5", "", ""),
                row("d", "-1%", "", ""));

        assertEquals(List.of("c", "a", "d", "b"), names(PreviewSort.CHANGE_RATE.sort(rows, false)));
    }

    @Test
    void sort_shouldBeStableForEqualKeys() {
        List<InstrumentRow> rows = List.of(
                row("first", "", "100", "5"),
                row("second", "", "100", "5"),
                row("big", "", "1,000", "1"));

        assertEquals(List.of("big", "first", "second"), names(PreviewSort.TRADE_VALUE.sort(rows, true)));
        assertEquals(List.of("first", "second", "big"), names(PreviewSort.VOLUME.sort(rows, false)));
        assertEquals(List.of("first", "second", "big"), names(PreviewSort.FILE_ORDER.sort(rows, false)));
    }
}
