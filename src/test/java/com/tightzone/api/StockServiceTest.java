package com.tightzone.api;

import com.tightzone.chart.ChartGenerator;
import com.tightzone.chart.ChartOutcome;
import com.tightzone.news.NewsFetcher;
import com.tightzone.news.NewsItem;
import com.tightzone.screener.Screener;
import com.tightzone.screener.ScreenerQuery;
import com.tightzone.screener.ScreenerRow;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StockServiceTest {

    @TempDir
    Path tmp;

    static JSONObject strongPage(List<String> columns) {
        JSONArray values = new JSONArray();
        for (String col : columns) {
            switch (col) {
                case "close": values.put(50.0); break;
                case "SMA200": values.put(40.0); break;
                case "market_cap_basic": values.put(3.5e9); break;
                case "beta_1_year": values.put(1.2); break;
                case "average_volume_30d_calc": values.put(3e7); break;
                default: values.put("Strong Inc");
            }
        }
        return new JSONObject()
                .put("columns", new JSONArray(columns))
                .put("data", new JSONArray().put(new JSONObject().put("s", "NASDAQ:STRONG").put("d", values)));
    }

    private StockService service(CountingNews news, RecordingCharts charts, int[] scans) {
        Screener screener = new Screener(request -> {
            scans[0]++;
            return strongPage(request.columns);
        }, 150);
        StockService.Settings settings = new StockService.Settings(tmp.resolve("charts"), "6mo", "1d", 3, 3);
        return new StockService(screener, ScreenerQuery.builder().columns(List.of("name")).build(),
                news, charts, new StockCache(tmp.resolve("cache.json")), settings);
    }

    @Test
    void getStocksShouldScanAttachNewsChartAndCacheWhenNoCache() throws Exception {
        CountingNews news = new CountingNews();
        RecordingCharts charts = new RecordingCharts();
        int[] scans = {0};
        StockService service = service(news, charts, scans);

        List<ScreenerRow> rows = service.getStocks(false);

        assertEquals(1, rows.size());
        assertEquals(1, scans[0]);
        assertEquals(1, news.calls);
        assertEquals(1, charts.calls);
        assertTrue(((List<?>) rows.get(0).get(StockService.NEWS_FIELD)).size() == 1);
        assertTrue(new StockCache(tmp.resolve("cache.json")).exists());
    }

    @Test
    void getStocksShouldServeCacheWithoutRescanning() throws Exception {
        CountingNews news = new CountingNews();
        RecordingCharts charts = new RecordingCharts();
        int[] scans = {0};
        StockService service = service(news, charts, scans);
        service.getStocks(false);

        List<ScreenerRow> cached = service.getStocks(false);

        assertEquals(1, scans[0]);
        assertEquals(1, news.calls);
        assertEquals("NASDAQ:STRONG", cached.get(0).symbol());
        assertEquals(50.0, cached.get(0).number("close"), 1e-9);
    }

    @Test
    void getStocksShouldAttachNewsToCachedEntriesWithout() throws Exception {
        StockCache cache = new StockCache(tmp.resolve("cache.json"));
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("close", 50.0);
        values.put("news", new ArrayList<>());
        cache.write(List.of(new ScreenerRow("NASDAQ:STRONG", values)));
        CountingNews news = new CountingNews();
        int[] scans = {0};

        List<ScreenerRow> rows = service(news, new RecordingCharts(), scans).getStocks(false);

        assertEquals(0, scans[0]);
        assertEquals(1, news.calls);
        assertEquals(1, ((List<?>) rows.get(0).get("news")).size());
        assertEquals(1, ((List<?>) cache.read().get(0).get("news")).size());
    }

    @Test
    void refreshShouldAlwaysRescan() throws Exception {
        int[] scans = {0};
        StockService service = service(new CountingNews(), new RecordingCharts(), scans);
        service.getStocks(false);
        service.refresh();
        assertEquals(2, scans[0]);
    }

    @Test
    void concurrentFirstCallsShouldScanOnce() throws Exception {
        int[] scans = {0};
        StockService service = service(new CountingNews(), new RecordingCharts(), scans);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<ScreenerRow>>> calls = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                calls.add(pool.submit(() -> {
                    start.await();
                    return service.getStocks(false);
                }));
            }
            start.countDown();
            for (Future<List<ScreenerRow>> call : calls) {
                assertEquals("NASDAQ:STRONG", call.get(10, TimeUnit.SECONDS).get(0).symbol());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, scans[0]);
    }

    @Test
    void cachedReadShouldNotOverwriteNewerRefresh() throws Exception {
        StockCache cache = new StockCache(tmp.resolve("cache.json"));
        Map<String, Object> stale = new LinkedHashMap<>();
        stale.put("close", 1.0);
        cache.write(List.of(new ScreenerRow("NYSE:STALE", stale)));
        int[] scans = {0};
        StockService service = service(new CountingNews(), new RecordingCharts(), scans);

        service.refresh();
        List<ScreenerRow> rows = service.getStocks(false);

        assertEquals(1, scans[0]);
        assertEquals("NASDAQ:STRONG", rows.get(0).symbol());
        assertEquals("NASDAQ:STRONG", cache.read().get(0).symbol());
    }

    static final class CountingNews extends NewsFetcher {
        int calls;

        CountingNews() {
            super(null, null, 5, Duration.ofMinutes(30));
        }

        @Override
        public List<NewsItem> fetchRecent(String symbol, int limit, int days) {
            calls++;
            return List.of(new NewsItem("Headline " + symbol, "https://x/" + calls, "Wire", "", Instant.now()));
        }
    }

    static final class RecordingCharts extends ChartGenerator {
        int calls;

        RecordingCharts() {
            super(null, null, 1);
        }

        @Override
        public Map<String, ChartOutcome> generate(List<ScreenerRow> rows, Path dir, String period, String interval) {
            calls++;
            Map<String, ChartOutcome> out = new LinkedHashMap<>();
            for (ScreenerRow row : rows) {
                row.enrich(CHART_ERROR_FIELD, NO_HISTORY);
                out.put(row.symbol(), ChartOutcome.failed(row.symbol(), NO_HISTORY));
            }
            return out;
        }
    }
}
