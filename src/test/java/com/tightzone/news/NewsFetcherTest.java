package com.tightzone.news;

import com.tightzone.core.ScreenerException;
import com.tightzone.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewsFetcherTest {
    private static final Instant NOW = Instant.parse("2024-06-10T12:00:00Z");

    private static JSONObject item(String title, String link, long publishedEpoch) {
        JSONObject obj = new JSONObject().put("providerPublishTime", publishedEpoch);
        if (title != null) obj.put("title", title);
        if (link != null) obj.put("link", link);
        return obj;
    }

    private static String body(JSONObject... items) {
        JSONArray news = new JSONArray();
        for (JSONObject item : items) {
            news.put(item);
        }
        return new JSONObject().put("news", news).toString();
    }

    private static NewsFetcher fetcher(HttpClientEx http, Instant now) {
        return new NewsFetcher(http, null, 5, Duration.ofMinutes(30), Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void fetchRecentShouldKeepOnlyFreshCompleteItems() {
        long fresh = NOW.minus(Duration.ofHours(5)).getEpochSecond();
        long stale = NOW.minus(Duration.ofDays(4)).getEpochSecond();
        StubHttp http = new StubHttp(body(
                item("Old story", "https://x/old", stale),
                item(null, "https://x/untitled", fresh),
                item("Fresh story", "https://x/fresh", fresh)
                        .put("publisher", "Reuters")
                        .put("summary", "<p>Shares <b>rose</b>&nbsp;5%</p>"),
                item("Second", "https://x/second", fresh)
                        .put("provider", new JSONObject().put("displayName", "Barron's")),
                item("Third", "https://x/third", fresh)
        ));

        List<NewsItem> items = fetcher(http, NOW).fetchRecent("NASDAQ:AAPL", 2, 3);

        assertEquals(2, items.size());
        assertEquals("Fresh story", items.get(0).title);
        assertEquals("Reuters", items.get(0).publisher);
        assertEquals("Shares rose 5%", items.get(0).summary);
        assertEquals("Barron's", items.get(1).publisher);
        assertTrue(http.lastUrl.contains("q=AAPL"));
        assertTrue(http.lastUrl.contains("newsCount=2"));
    }

    @Test
    void fetchRecentShouldFallBackToUnknownPublisher() {
        StubHttp http = new StubHttp(body(item("Story", "https://x/1", NOW.getEpochSecond())));
        NewsItem item = fetcher(http, NOW).fetchRecent("AAPL", 3, 3).get(0);
        assertEquals(NewsFetcher.UNKNOWN_PUBLISHER, item.publisher);
        assertEquals("", item.summary);
    }

    @Test
    void fetchRecentShouldReturnEmptyListOnFailure() {
        StubHttp http = new StubHttp(null);
        assertTrue(fetcher(http, NOW).fetchRecent("AAPL", 3, 3).isEmpty());
        assertTrue(fetcher(new StubHttp("not json"), NOW).fetchRecent("AAPL", 3, 3).isEmpty());
    }

    @Test
    void fetchRecentShouldReuseCacheWithinTtl() {
        StubHttp http = new StubHttp(body(item("Story", "https://x/1", NOW.getEpochSecond())));
        NewsFetcher fetcher = fetcher(http, NOW);

        fetcher.fetchRecent("AAPL", 3, 3);
        fetcher.fetchRecent("NASDAQ:AAPL", 3, 3);

        assertEquals(1, http.calls);
    }

    @Test
    void fetchRecentShouldSkipBlankSymbol() {
        StubHttp http = new StubHttp(body());
        assertTrue(fetcher(http, NOW).fetchRecent("NASDAQ:", 3, 3).isEmpty());
        assertEquals(0, http.calls);
    }

    private static final class StubHttp extends HttpClientEx {
        private final String body;
        int calls;
        String lastUrl;

        private StubHttp(String body) {
            this.body = body;
        }

        @Override
        public String getText(String url, int timeoutSeconds) {
            calls++;
            lastUrl = url;
            if (body == null) {
                throw ScreenerException.transport("HTTP 503 for " + url, null);
            }
            return body;
        }
    }
}
