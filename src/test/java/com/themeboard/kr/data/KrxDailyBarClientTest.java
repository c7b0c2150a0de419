package com.themeboard.kr.data;

import com.themeboard.core.diagnostics.CauseCode;
import com.themeboard.core.diagnostics.Outcome;
import com.themeboard.kr.config.Config;
import com.themeboard.kr.model.BarDaily;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KrxDailyBarClientTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 5);

    @Test
    void expand_shouldFillAllPlaceholders() {
        assertEquals("https://x/005930?d=20240105&iso=2024-01-05",
                KrxDailyBarClient.expand("https://x/{code}?d={date}&iso={date_iso}", DAY, "005930"));
    }

    @Test
    void parseDailyCsv_shouldSkipBadLinesAndSortByDate() {
        String body = "\uFEFFDate,Open,High,Low,Close,Volume\n"
                + "2024-01-05,100,110,95,105,1000\n"
                + "2024-01-04,98,101,97,99,900\n"
                + "broken,line\n"
                + "2024-01-03,1,1,1,0,1\n";

        List<BarDaily> bars = KrxDailyBarClient.parseDailyCsv("005930", body);

        assertEquals(2, bars.size());
        assertEquals(LocalDate.of(2024, 1, 4), bars.get(0).tradeDate);
        assertEquals(105.0, bars.get(1).close);
        assertEquals(110.0, bars.get(1).high);
    }

    @Test
    void parseDailyCsv_shouldTreatNoDataAsEmptyAndRejectForeignPayloads() {
        assertTrue(KrxDailyBarClient.parseDailyCsv("005930", "No data").isEmpty());
        assertThrows(IllegalStateException.class,
                () -> KrxDailyBarClient.parseDailyCsv("005930", "<html>blocked</html>"));
        assertThrows(IllegalStateException.class,
                () -> KrxDailyBarClient.parseDailyCsv("005930", "Exceeded the daily hits limit"));
    }

    @Test
    void parseBulkCsv_shouldKeyByNormalizedCode() {
        String body = "code,open,high,low,close,volume\n"
                + "5930,70000,71000,69500,70500,100\n"
                + "A000660,120000,125000,119000,124000,50\n";

        Map<String, BarDaily> bars = KrxDailyBarClient.parseBulkCsv(DAY, body);

        assertEquals(2, bars.size());
        assertEquals(70500.0, bars.get("005930").close);
        assertEquals(DAY, bars.get("000660").tradeDate);
    }

    @Test
    void classifyFailureMessage_shouldGroupTimeoutsAndRateLimits() {
        assertEquals("timeout", KrxDailyBarClient.classifyFailureMessage("request timed out"));
        assertEquals("rate_limit", KrxDailyBarClient.classifyFailureMessage("price http status=429"));
        assertEquals("other", KrxDailyBarClient.classifyFailureMessage(null));
    }

    @Test
    void fetchAllByCode_shouldReportBulkUnavailableWithoutUrl() {
        KrxDailyBarClient client = new KrxDailyBarClient(Config.fromConfigurationProperties(Path.of("."), Map.of()));

        Outcome<Map<String, BarDaily>> outcome = client.fetchAllByCode(DAY);

        assertFalse(outcome.success);
        assertEquals(CauseCode.BULK_UNAVAILABLE, outcome.causeCode);
    }

    @Test
    void fetchDay_shouldParseDownloadedBodyAndRejectUnresolvableCodes() {
        List<String> urls = new ArrayList<>();
        KrxDailyBarClient client = new KrxDailyBarClient(Config.fromConfigurationProperties(Path.of("."),
                Map.of("price", Map.of("daily_url", "http://local/{code}/{date}")))) {
            @Override
            protected Outcome<String> download(String url) {
                urls.add(url);
                return Outcome.success("Date,Open,High,Low,Close,Volume\n2024-01-05,100,120,90,110,10\n", "test");
            }
        };

        Outcome<BarDaily> ok = client.fetchDay(DAY, "A005930");
        Outcome<BarDaily> bad = client.fetchDay(DAY, "n/a");

        assertTrue(ok.success);
        assertEquals(110.0, ok.value.close);
        assertEquals(List.of("http://local/005930/20240105"), urls);
        assertFalse(bad.success);
        assertEquals(CauseCode.CODE_UNRESOLVED, bad.causeCode);
    }
}
