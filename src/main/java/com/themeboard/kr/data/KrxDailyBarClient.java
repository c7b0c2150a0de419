package com.themeboard.kr.data;

import com.themeboard.core.diagnostics.CauseCode;
import com.themeboard.core.diagnostics.Outcome;
import com.themeboard.kr.config.Config;
import com.themeboard.kr.model.BarDaily;
import com.themeboard.utils.InstrumentCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP daily-bar client. Both endpoints answer plain CSV:
 * per-instrument {@code date,open,high,low,close,volume} and bulk
 * {@code code,open,high,low,close,volume}.
 */
public class KrxDailyBarClient implements DailyBarSource {
    private static final Logger LOG = LogManager.getLogger(KrxDailyBarClient.class);
    private static final String OWNER = "krx_daily_bar";
    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    private final String dailyUrl;
    private final String bulkUrl;
    private final int timeoutSec;
    private final int retryCount;
    private final long retrySleepMs;
    private final long requestPauseMs;
    private final int timeoutStreakThreshold;
    private final long circuitCooldownMs;
    private final HttpClient httpClient;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);
    private final AtomicInteger timeoutStreak = new AtomicInteger(0);
    private final AtomicLong circuitOpenUntilNanos = new AtomicLong(0L);

    public KrxDailyBarClient(Config config) {
        this.dailyUrl = config.getString("price.daily_url",
                "https://stooq.com/q/d/l/?s={code}.kr&d1={date}&d2={date}&i=d");
        this.bulkUrl = config.getString("price.bulk_url", "");
        this.timeoutSec = Math.max(2, config.getInt("price.request_timeout_sec", 8));
        this.retryCount = Math.max(0, config.getInt("price.retry_count", 1));
        this.retrySleepMs = Math.max(100L, config.getLong("price.retry_sleep_ms", 500L));
        this.requestPauseMs = Math.max(0L, config.getLong("price.request_pause_ms", 0L));
        this.timeoutStreakThreshold = Math.max(1, config.getInt("price.circuit_breaker.timeout_streak", 10));
        this.circuitCooldownMs = Math.max(0L, config.getLong("price.circuit_breaker.cooldown_sec", 60L) * 1000L);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutSec))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Outcome<BarDaily> fetchDay(LocalDate day, String code) {
        String normalized = InstrumentCodes.normalize(code);
        if (day == null || normalized.isEmpty()) {
            return Outcome.failure(CauseCode.CODE_UNRESOLVED, OWNER);
        }
        Outcome<String> body = download(expand(dailyUrl, day, normalized));
        if (!body.success) {
            return Outcome.failure(body.causeCode, OWNER, body.details);
        }
        try {
            List<BarDaily> bars = parseDailyCsv(normalized, body.value);
            if (bars.isEmpty()) {
                return Outcome.failure(CauseCode.NO_BARS, OWNER, Map.of("code", normalized, "day", day.toString()));
            }
            return Outcome.success(bars.get(bars.size() - 1), OWNER);
        } catch (IllegalStateException e) {
            return Outcome.failure(CauseCode.FETCH_FAILED, OWNER, Map.of("error", safe(e.getMessage())));
        }
    }

    @Override
    public Outcome<Map<String, BarDaily>> fetchAllByCode(LocalDate day) {
        if (day == null || bulkUrl.isEmpty()) {
            return Outcome.failure(CauseCode.BULK_UNAVAILABLE, OWNER);
        }
        Outcome<String> body = download(expand(bulkUrl, day, ""));
        if (!body.success) {
            return Outcome.failure(CauseCode.BULK_UNAVAILABLE, OWNER, body.details);
        }
        try {
            Map<String, BarDaily> bars = parseBulkCsv(day, body.value);
            if (bars.isEmpty()) {
                return Outcome.failure(CauseCode.BULK_UNAVAILABLE, OWNER, Map.of("day", day.toString()));
            }
            return Outcome.success(bars, OWNER);
        } catch (IllegalStateException e) {
            return Outcome.failure(CauseCode.BULK_UNAVAILABLE, OWNER, Map.of("error", safe(e.getMessage())));
        }
    }

    /**
     * Network failures and timeouts come back as a failed outcome; only the retry budget differs.
     */
    protected Outcome<String> download(String url) {
        String lastError = "";
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            try {
                waitIfCircuitOpen();
                throttleRequest(requestPauseMs);
                HttpRequest request = HttpRequest.newBuilder()
                        .uri(URI.create(url))
                        .header("User-Agent", "themeboard/1.4")
                        .timeout(Duration.ofSeconds(timeoutSec))
                        .GET()
                        .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() / 100 != 2) {
                    throw new IllegalStateException("price http status=" + response.statusCode());
                }
                onRequestResult(true, "");
                return Outcome.success(response.body(), OWNER);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Outcome.failure(CauseCode.FETCH_FAILED, OWNER, Map.of("error", "interrupted"));
            } catch (Exception e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                onRequestResult(false, classifyFailureMessage(lastError));
                if (attempt >= retryCount || !isRetryable(lastError)) {
                    break;
                }
                try {
                    Thread.sleep(retrySleepMs * (attempt + 1));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return Outcome.failure(CauseCode.FETCH_FAILED, OWNER, Map.of("error", "interrupted"));
                }
            }
        }
        LOG.debug("price fetch failed url={} err={}", url, lastError);
        return Outcome.failure(CauseCode.FETCH_FAILED, OWNER, Map.of("error", lastError));
    }

    static String expand(String template, LocalDate day, String code) {
        return template
                .replace("{date}", BASIC.format(day))
                .replace("{date_iso}", day.toString())
                .replace("{code}", code == null ? "" : code);
    }

    static List<BarDaily> parseDailyCsv(String code, String body) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            return List.of();
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new IllegalStateException("price_rate_limit");
        }
        String[] lines = text.split("\\r?\\n");
        String header = stripBom(lines[0]).trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new IllegalStateException("unexpected_price_payload:" + sample);
        }
        List<BarDaily> out = new ArrayList<>();
        for (int i = 1; i < lines.length; i++) {
            String[] cols = lines[i].trim().split(",");
            if (cols.length < 5) {
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim());
                double close = parseDouble(cols[4]);
                if (close <= 0) {
                    continue;
                }
                double volume = cols.length >= 6 ? parseDouble(cols[5]) : 0.0;
                out.add(new BarDaily(code, date, parseDouble(cols[1]), parseDouble(cols[2]), parseDouble(cols[3]), close, volume));
            } catch (Exception ignored) {
                // Skip malformed line.
            }
        }
        out.sort(Comparator.comparing(b -> b.tradeDate));
        return out;
    }

    static Map<String, BarDaily> parseBulkCsv(LocalDate day, String body) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty()) {
            return Map.of();
        }
        String[] lines = text.split("\\r?\\n");
        String header = stripBom(lines[0]).trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("code,open,high,low,close")) {
            throw new IllegalStateException("unexpected_bulk_payload");
        }
        Map<String, BarDaily> out = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            String[] cols = lines[i].trim().split(",");
            if (cols.length < 5) {
                continue;
            }
            String code = InstrumentCodes.normalize(cols[0]);
            if (code.isEmpty() || out.containsKey(code)) {
                continue;
            }
            try {
                double close = parseDouble(cols[4]);
                double volume = cols.length >= 6 ? parseDouble(cols[5]) : 0.0;
                out.put(code, new BarDaily(code, day, parseDouble(cols[1]), parseDouble(cols[2]), parseDouble(cols[3]), close, volume));
            } catch (Exception ignored) {
                // Skip malformed line.
            }
        }
        return out;
    }

    public static String classifyFailureMessage(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return "timeout";
        }
        if (msg.contains("rate_limit") || msg.contains("http status=429")) {
            return "rate_limit";
        }
        return "other";
    }

    private boolean isRetryable(String message) {
        String category = classifyFailureMessage(message);
        if ("timeout".equals(category) || "rate_limit".equals(category)) {
            return true;
        }
        String msg = message == null ? "" : message;
        return msg.contains("http status=500") || msg.contains("http status=502")
                || msg.contains("http status=503") || msg.contains("http status=504");
    }

    private void onRequestResult(boolean success, String failureCategory) {
        if (success || !"timeout".equals(failureCategory)) {
            timeoutStreak.set(0);
            return;
        }
        int streak = timeoutStreak.incrementAndGet();
        if (streak < timeoutStreakThreshold || circuitCooldownMs <= 0L) {
            return;
        }
        timeoutStreak.set(0);
        long openUntil = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(circuitCooldownMs);
        while (true) {
            long prev = circuitOpenUntilNanos.get();
            long next = Math.max(prev, openUntil);
            if (circuitOpenUntilNanos.compareAndSet(prev, next)) {
                if (next > prev) {
                    LOG.warn("price circuit breaker open: timeout_streak={} cooldown={}s",
                            timeoutStreakThreshold, Math.max(1L, circuitCooldownMs / 1000L));
                }
                return;
            }
        }
    }

    private void waitIfCircuitOpen() throws InterruptedException {
        while (true) {
            long until = circuitOpenUntilNanos.get();
            long now = System.nanoTime();
            if (until <= now) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(until - now);
        }
    }

    private void throttleRequest(long pauseMs) throws InterruptedException {
        if (pauseMs <= 0L) {
            return;
        }
        long pauseNanos = pauseMs * 1_000_000L;
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev + pauseNanos;
            if (now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return 0.0;
        }
        return Double.parseDouble(v);
    }

    private static String stripBom(String value) {
        if (value != null && !value.isEmpty() && value.charAt(0) == '\uFEFF') {
            return value.substring(1);
        }
        return value == null ? "" : value;
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
