package com.jay.trendagent.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.trendagent.model.OHLCVBar;
import com.jay.trendagent.model.VenueLimits;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bybit v5 public REST client: klines and instrument lot-size filters.
 * Public endpoints only, so no request signing.
 */
@Slf4j
public class BybitMarketDataClient {

    private static final int MAX_KLINE_LIMIT = 1000;

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String category;

    private final Map<String, VenueLimits> limitsCache = new ConcurrentHashMap<>();

    public BybitMarketDataClient(OkHttpClient http, ObjectMapper objectMapper, String baseUrl, String category) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.category = category;
    }

    // ── Klines ─────────────────────────────────────────────────────────────────

    /**
     * Fetches the latest {@code limit} candles, oldest first.
     */
    public List<OHLCVBar> fetchKlines(String symbol, String timeframe, int limit) throws IOException {
        HttpUrl url = HttpUrl.get(baseUrl + "/v5/market/kline").newBuilder()
            .addQueryParameter("category", category)
            .addQueryParameter("symbol", symbol)
            .addQueryParameter("interval", toInterval(timeframe))
            .addQueryParameter("limit", String.valueOf(Math.min(limit, MAX_KLINE_LIMIT)))
            .build();
        return parseKlines(get(url));
    }

    /** Bybit returns klines newest first as string arrays [start, open, high, low, close, volume, turnover]. */
    List<OHLCVBar> parseKlines(JsonNode root) {
        JsonNode list = root.path("result").path("list");
        List<OHLCVBar> bars = new ArrayList<>();
        for (JsonNode row : list) {
            bars.add(OHLCVBar.builder()
                .timestamp(Instant.ofEpochMilli(row.get(0).asLong()))
                .open(row.get(1).asDouble())
                .high(row.get(2).asDouble())
                .low(row.get(3).asDouble())
                .close(row.get(4).asDouble())
                .volume(row.get(5).asDouble())
                .build());
        }
        Collections.reverse(bars);
        return bars;
    }

    // ── Instrument limits ──────────────────────────────────────────────────────

    /**
     * Lot-size filter for a symbol, cached after the first successful call.
     */
    public VenueLimits instrumentLimits(String symbol) throws IOException {
        VenueLimits cached = limitsCache.get(symbol);
        if (cached != null) return cached;

        HttpUrl url = HttpUrl.get(baseUrl + "/v5/market/instruments-info").newBuilder()
            .addQueryParameter("category", category)
            .addQueryParameter("symbol", symbol)
            .build();
        VenueLimits limits = parseLimits(get(url), symbol);
        limitsCache.put(symbol, limits);
        log.info("Venue limits for {}: minQty={} step={} minNotional={}",
            symbol, limits.minQuantity(), limits.quantityStep(), limits.minNotional());
        return limits;
    }

    /** Derivatives report qtyStep/minNotionalValue, spot reports basePrecision/minOrderAmt. */
    VenueLimits parseLimits(JsonNode root, String symbol) throws IOException {
        JsonNode list = root.path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new IOException("No instrument info for " + symbol);
        }
        JsonNode lot = list.get(0).path("lotSizeFilter");
        double minQty = lot.path("minOrderQty").asDouble(0);
        double step = lot.has("qtyStep")
            ? lot.path("qtyStep").asDouble(0)
            : lot.path("basePrecision").asDouble(0);
        double minNotional = lot.has("minNotionalValue")
            ? lot.path("minNotionalValue").asDouble(0)
            : lot.path("minOrderAmt").asDouble(0);
        return new VenueLimits(minQty, minNotional, step > 0 ? step : VenueLimits.DEFAULT_STEP);
    }

    // ── HTTP Helpers ───────────────────────────────────────────────────────────

    private JsonNode get(HttpUrl url) throws IOException {
        Request request = new Request.Builder()
            .url(url)
            .addHeader("Accept", "application/json")
            .get()
            .build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("HTTP " + response.code() + " from " + url.encodedPath());
            }
            JsonNode root = objectMapper.readTree(response.body().string());
            int retCode = root.path("retCode").asInt(-1);
            if (retCode != 0) {
                throw new IOException("Bybit retCode " + retCode + ": " + root.path("retMsg").asText());
            }
            return root;
        }
    }

    /** Maps 1m/5m/1h/4h/1d style timeframes to Bybit interval codes. */
    static String toInterval(String timeframe) {
        String tf = timeframe.trim().toLowerCase();
        char unit = tf.charAt(tf.length() - 1);
        int n = Integer.parseInt(tf.substring(0, tf.length() - 1));
        return switch (unit) {
            case 'm' -> String.valueOf(n);
            case 'h' -> String.valueOf(n * 60);
            case 'd' -> single(n, "D", timeframe);
            case 'w' -> single(n, "W", timeframe);
            default -> throw new IllegalArgumentException("Unsupported timeframe: " + timeframe);
        };
    }

    /** Bybit has no multi-day or multi-week klines. */
    private static String single(int n, String interval, String timeframe) {
        if (n != 1) {
            throw new IllegalArgumentException("Unsupported timeframe: " + timeframe);
        }
        return interval;
    }
}
