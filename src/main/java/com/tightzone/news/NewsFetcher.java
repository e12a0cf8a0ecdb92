package com.tightzone.news;

import com.tightzone.chart.PriceHistoryClient;
import com.tightzone.core.ScreenerException;
import com.tightzone.data.http.HttpClientEx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.jsoup.Jsoup;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模块说明：NewsFetcher（class）。
 * 主要职责：按代码拉取 Yahoo 搜索接口中的近期新闻，清洗摘要 HTML，并按代码做短期内存缓存。
 * 使用建议：新闻只是展示信息，任何失败都记录日志并返回空列表，不影响扫描结果。
 */
public class NewsFetcher {
    private static final Logger log = LogManager.getLogger(NewsFetcher.class);

    public static final String DEFAULT_ENDPOINT = "https://query1.finance.yahoo.com/v1/finance/search";
    public static final String UNKNOWN_PUBLISHER = "Unknown";

    private final HttpClientEx http;
    private final String endpoint;
    private final int timeoutSec;
    private final Duration cacheTtl;
    private final Clock clock;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    public NewsFetcher(HttpClientEx http, String endpoint, int timeoutSec, Duration cacheTtl) {
        this(http, endpoint, timeoutSec, cacheTtl, Clock.systemUTC());
    }

    NewsFetcher(HttpClientEx http, String endpoint, int timeoutSec, Duration cacheTtl, Clock clock) {
        this.http = http;
        this.endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
        this.timeoutSec = Math.max(1, timeoutSec);
        this.cacheTtl = cacheTtl == null ? Duration.ofMinutes(30) : cacheTtl;
        this.clock = clock;
    }

    public String searchUrl(String ticker, int limit) {
        return endpoint
                + "?q=" + URLEncoder.encode(ticker, StandardCharsets.UTF_8)
                + "&lang=en-US&region=US&quotesCount=0&newsCount=" + limit;
    }

/**
 * 方法说明：fetchRecent，负责获取某代码最近 days 天内至多 limit 条新闻。
 * 处理流程：先查缓存；未命中时请求接口并解析，失败结果同样缓存为空列表，避免反复请求。
 */
    public List<NewsItem> fetchRecent(String symbol, int limit, int days) {
        String ticker = PriceHistoryClient.normalizeSymbol(symbol);
        if (ticker.isEmpty() || limit <= 0) {
            return List.of();
        }
        String key = ticker + "|" + limit + "|" + days;
        Instant now = clock.instant();
        CacheEntry cached = cache.get(key);
        if (cached != null && Duration.between(cached.at, now).compareTo(cacheTtl) < 0) {
            return cached.items;
        }

        List<NewsItem> items;
        try {
            String body = http.getText(searchUrl(ticker, limit), timeoutSec);
            items = parse(new JSONObject(body), limit, days, now);
        } catch (ScreenerException | JSONException e) {
            log.warn("news fetch failed symbol={} err={}", symbol, e.getMessage());
            items = List.of();
        }
        cache.put(key, new CacheEntry(now, items));
        return items;
    }

    static List<NewsItem> parse(JSONObject payload, int limit, int days, Instant now) {
        JSONArray news = payload.optJSONArray("news");
        if (news == null) {
            return List.of();
        }
        Instant cutoff = now.minus(Duration.ofDays(Math.max(0, days)));
        List<NewsItem> out = new ArrayList<>();
        for (int i = 0; i < news.length() && out.size() < limit; i++) {
            JSONObject item = news.optJSONObject(i);
            if (item == null) {
                continue;
            }
            Object title = item.opt("title");
            Object link = item.opt("link");
            if (!(title instanceof String) || !(link instanceof String)) {
                continue;
            }
            Object published = item.opt("providerPublishTime");
            if (!(published instanceof Number)) {
                continue;
            }
            Instant publishedAt = Instant.ofEpochMilli(Math.round(((Number) published).doubleValue() * 1000.0));
            if (publishedAt.isBefore(cutoff)) {
                continue;
            }
            out.add(new NewsItem((String) title, (String) link, publisherOf(item),
                    cleanText(item.optString("summary", "")), publishedAt));
        }
        return List.copyOf(out);
    }

    static String publisherOf(JSONObject item) {
        String publisher = item.optString("publisher", "");
        if (!publisher.isBlank()) {
            return publisher;
        }
        JSONObject provider = item.optJSONObject("provider");
        String display = provider == null ? "" : provider.optString("displayName", "");
        return display.isBlank() ? UNKNOWN_PUBLISHER : display;
    }

    static String cleanText(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return Jsoup.parse(raw).text()
                .replace('\u00a0', ' ')
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static final class CacheEntry {
        final Instant at;
        final List<NewsItem> items;

        CacheEntry(Instant at, List<NewsItem> items) {
            this.at = at;
            this.items = items;
        }
    }
}
