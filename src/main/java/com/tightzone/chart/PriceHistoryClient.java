package com.tightzone.chart;

import com.tightzone.core.ScreenerException;
import com.tightzone.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：PriceHistoryClient（class）。
 * 主要职责：从 Yahoo chart 接口拉取日线收盘价与成交量，并严格解析响应结构。
 * 使用建议：结构缺失视为 DECODE 失败而不是空结果，调用方据此区分"无数据"和"坏数据"。
 */
public class PriceHistoryClient {
    public static final String DEFAULT_ENDPOINT = "https://query1.finance.yahoo.com/v8/finance/chart/";

    private final HttpClientEx http;
    private final String endpoint;
    private final int timeoutSec;

    public PriceHistoryClient(HttpClientEx http) {
        this(http, DEFAULT_ENDPOINT, 10);
    }

    public PriceHistoryClient(HttpClientEx http, String endpoint, int timeoutSec) {
        this.http = http;
        String base = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
        this.endpoint = base.endsWith("/") ? base : base + "/";
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    public String historyUrl(String symbol, String period, String interval) {
        String ticker = URLEncoder.encode(normalizeSymbol(symbol), StandardCharsets.UTF_8).replace("+", "%20");
        return endpoint + ticker + "?interval=" + interval + "&range=" + period;
    }

/**
 * 方法说明：fetch，负责拉取一个代码的价格序列。
 * 处理流程：网络失败抛出 TRANSPORT，正文不是 JSON 或结构不完整抛出 DECODE。
 */
    public List<PriceBar> fetch(String symbol, String period, String interval) {
        if (normalizeSymbol(symbol).isEmpty()) {
            throw ScreenerException.invalidInput("symbol must not be empty");
        }
        String body = http.getText(historyUrl(symbol, period, interval), timeoutSec);
        JSONObject root;
        try {
            root = new JSONObject(body);
        } catch (JSONException e) {
            throw ScreenerException.decode("invalid JSON in price history of " + symbol, e);
        }
        return parse(root);
    }

    /**
     * Strips an optional {@code EXCHANGE:} prefix.
     */
    public static String normalizeSymbol(String symbol) {
        if (symbol == null) {
            return "";
        }
        int colon = symbol.indexOf(':');
        return (colon >= 0 ? symbol.substring(colon + 1) : symbol).trim();
    }

    public static List<PriceBar> parse(JSONObject root) {
        JSONObject chart = root == null ? null : root.optJSONObject("chart");
        if (chart == null) {
            throw ScreenerException.decode("price history response missing chart data");
        }
        JSONArray result = chart.optJSONArray("result");
        if (result == null || result.isEmpty()) {
            throw ScreenerException.decode("price history response missing result data");
        }
        JSONObject entries = result.optJSONObject(0);
        if (entries == null) {
            throw ScreenerException.decode("price history response malformed");
        }
        JSONArray timestamps = entries.optJSONArray("timestamp");
        JSONObject indicators = entries.optJSONObject("indicators");
        if (timestamps == null || indicators == null) {
            throw ScreenerException.decode("price history response missing indicators");
        }
        JSONArray quotes = indicators.optJSONArray("quote");
        if (quotes == null || quotes.isEmpty()) {
            throw ScreenerException.decode("price history quote data missing");
        }
        JSONObject quote = quotes.optJSONObject(0);
        if (quote == null) {
            throw ScreenerException.decode("price history quote data malformed");
        }
        JSONArray closes = quote.optJSONArray("close");
        if (closes == null) {
            throw ScreenerException.decode("price history close prices missing");
        }
        JSONArray volumes = quote.optJSONArray("volume");

        int n = Math.min(timestamps.length(), closes.length());
        if (volumes != null) {
            n = Math.min(n, volumes.length());
        }
        List<PriceBar> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Object close = closes.opt(i);
            Object ts = timestamps.opt(i);
            if (!(close instanceof Number) || !(ts instanceof Number)) {
                continue;
            }
            Object volume = volumes == null ? null : volumes.opt(i);
            double volumeValue = volume instanceof Number ? ((Number) volume).doubleValue() : 0.0;
            Instant at = Instant.ofEpochMilli(Math.round(((Number) ts).doubleValue() * 1000.0));
            out.add(new PriceBar(at, ((Number) close).doubleValue(), volumeValue));
        }
        return out;
    }
}
