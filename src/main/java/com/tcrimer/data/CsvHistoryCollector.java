package com.tcrimer.data;

import com.tcrimer.config.Config;
import com.tcrimer.model.Bar;
import com.tcrimer.model.TimeRange;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Timeframe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Daily OHLCV history from an HTTP endpoint serving {@code date,open,high,low,close,volume} CSV.
 * <p>
 * Timeouts, HTTP 429 and 5xx are retried with linear backoff. A streak of timeouts opens a circuit
 * breaker; while it is open requests fail fast as timed out instead of queueing behind a dead host.
 */
public final class CsvHistoryCollector implements MarketDataCollector {
    private static final Logger log = LogManager.getLogger(CsvHistoryCollector.class);
    private static final String HEADER = "date,open,high,low,close,volume";

    private final String baseUrl;
    private final int timeoutSec;
    private final int retryCount;
    private final long retrySleepMs;
    private final int timeoutStreakThreshold;
    private final long circuitCooldownMs;
    private final HttpClient httpClient;
    private final AtomicInteger timeoutStreak = new AtomicInteger(0);
    private final AtomicLong circuitOpenUntilNanos = new AtomicLong(0L);

    public CsvHistoryCollector(Config config) {
        this.baseUrl = config.getString("upstream.base_url");
        this.timeoutSec = Math.max(1, config.getInt("upstream.fetch_timeout_seconds"));
        this.retryCount = Math.max(0, config.getInt("upstream.retry_count"));
        this.retrySleepMs = Math.max(0L, config.getLong("upstream.retry_sleep_ms"));
        this.timeoutStreakThreshold = Math.max(1, config.getInt("upstream.circuit_breaker.timeout_streak"));
        this.circuitCooldownMs = Math.max(0L, config.getLong("upstream.circuit_breaker.cooldown_sec") * 1000L);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutSec))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String sourceName() {
        return "csv_http";
    }

    @Override
    public TimeSeries fetchSeries(String symbol, Timeframe timeframe, TimeRange range) throws MarketDataException {
        if (timeframe != Timeframe.D1) {
            throw new MarketDataException(symbol, "csv history only serves daily bars, requested " + timeframe.code(), false);
        }
        List<Bar> all = fetchDaily(symbol);
        return new TimeSeries(symbol, timeframe, all).slice(range);
    }

    @Override
    public Bar fetchLatest(String symbol) throws MarketDataException {
        List<Bar> all = fetchDaily(symbol);
        if (all.isEmpty()) {
            throw new MarketDataException(symbol, "no bars returned for " + symbol, false);
        }
        return all.get(all.size() - 1);
    }

    List<Bar> fetchDaily(String symbol) throws MarketDataException {
        String remote = symbol.toLowerCase(Locale.ROOT).replace("-", "").replace("/", "").trim();
        if (remote.isEmpty()) {
            throw new MarketDataException(symbol, "blank symbol", false);
        }
        String lastError = "";
        boolean lastTimedOut = false;
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            if (circuitOpen()) {
                throw new MarketDataException(symbol, "upstream circuit open after repeated timeouts", true);
            }
            try {
                HttpRequest request = HttpRequest.newBuilder()
                        .uri(URI.create(String.format(baseUrl, remote)))
                        .header("User-Agent", "tcrimer-core/1.0")
                        .timeout(Duration.ofSeconds(timeoutSec))
                        .GET()
                        .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() / 100 != 2) {
                    throw new IOException("http status=" + response.statusCode());
                }
                List<Bar> bars = parseCsv(symbol, response.body());
                timeoutStreak.set(0);
                return bars;
            } catch (HttpTimeoutException e) {
                lastError = "timed out after " + timeoutSec + "s";
                lastTimedOut = true;
                onTimeout();
            } catch (IOException e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                lastTimedOut = false;
                timeoutStreak.set(0);
                if (!isRetryable(lastError)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MarketDataException(symbol, "interrupted while fetching " + symbol, false, e);
            }
            if (attempt < retryCount && !sleep(retrySleepMs * (attempt + 1))) {
                throw new MarketDataException(symbol, "interrupted while fetching " + symbol, false);
            }
        }
        log.warn("upstream fetch failed symbol={} attempts={} timed_out={} err={}", symbol, retryCount + 1, lastTimedOut, lastError);
        throw new MarketDataException(symbol, "upstream fetch failed for " + symbol + ": " + lastError, lastTimedOut);
    }

    static List<Bar> parseCsv(String symbol, String body) throws MarketDataException {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            return List.of();
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new MarketDataException(symbol, "upstream rate limit", false);
        }
        String[] lines = text.split("\\r?\\n");
        if (!lines[0].trim().toLowerCase(Locale.ROOT).startsWith(HEADER)) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new MarketDataException(symbol, "unexpected payload: " + sample, false);
        }
        List<Bar> all = new ArrayList<>(Math.max(64, lines.length));
        int skipped = 0;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",");
            if (cols.length < 5) {
                skipped++;
                continue;
            }
            try {
                double close = parseDouble(cols[4]);
                if (close <= 0.0) {
                    skipped++;
                    continue;
                }
                all.add(new Bar(
                        parseTimestamp(cols[0]),
                        parseDouble(cols[1]),
                        parseDouble(cols[2]),
                        parseDouble(cols[3]),
                        close,
                        cols.length >= 6 ? parseDouble(cols[5]) : 0.0
                ));
            } catch (RuntimeException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("csv parse symbol={} skipped_lines={}", symbol, skipped);
        }
        all.sort(Comparator.comparing(bar -> bar.timestamp));
        List<Bar> unique = new ArrayList<>(all.size());
        for (Bar bar : all) {
            if (unique.isEmpty() || bar.timestamp.isAfter(unique.get(unique.size() - 1).timestamp)) {
                unique.add(bar);
            }
        }
        return unique;
    }

    private static Instant parseTimestamp(String raw) {
        String value = raw.trim();
        if (value.matches("\\d{10,}")) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return 0.0;
        }
        return Double.parseDouble(v);
    }

    private boolean isRetryable(String message) {
        String msg = message.toLowerCase(Locale.ROOT);
        return msg.contains("connection reset")
                || msg.contains("http status=429")
                || msg.contains("http status=5");
    }

    private void onTimeout() {
        int streak = timeoutStreak.incrementAndGet();
        if (streak < timeoutStreakThreshold || circuitCooldownMs <= 0L) {
            return;
        }
        timeoutStreak.set(0);
        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(circuitCooldownMs);
        circuitOpenUntilNanos.accumulateAndGet(until, Math::max);
        log.warn("upstream circuit breaker open timeout_streak={} cooldown_ms={}", timeoutStreakThreshold, circuitCooldownMs);
    }

    private boolean circuitOpen() {
        long until = circuitOpenUntilNanos.get();
        return until != 0L && until - System.nanoTime() > 0L;
    }

    private boolean sleep(long millis) {
        if (millis <= 0L) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
