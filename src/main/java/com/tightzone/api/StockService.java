package com.tightzone.api;

import com.tightzone.chart.ChartGenerator;
import com.tightzone.news.NewsFetcher;
import com.tightzone.news.NewsItem;
import com.tightzone.screener.Screener;
import com.tightzone.screener.ScreenerQuery;
import com.tightzone.screener.ScreenerRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：StockService（class）。
 * 主要职责：为 HTTP 接口提供 VCP 股票列表；优先读缓存文件，缺失或强制刷新时重新扫描、配新闻与图表并落盘。
 * 使用建议：读缓存时只为没有新闻的条目补新闻，有补充才回写缓存。
 */
public class StockService {
    private static final Logger log = LogManager.getLogger(StockService.class);

    public static final String NEWS_FIELD = "news";

    private final Screener screener;
    private final ScreenerQuery query;
    private final NewsFetcher news;
    private final ChartGenerator charts;
    private final StockCache cache;
    private final Settings settings;
    private final Object refreshLock = new Object();

    public StockService(Screener screener, ScreenerQuery query, NewsFetcher news, ChartGenerator charts,
                        StockCache cache, Settings settings) {
        this.screener = screener;
        this.query = query.isApplyVcpFilter() ? query : query.toBuilder().applyVcpFilter(true).build();
        this.news = news;
        this.charts = charts;
        this.cache = cache;
        this.settings = settings;
    }

    public Path chartsDir() {
        return settings.chartsDir;
    }

/**
 * 方法说明：getStocks，负责返回当前股票列表。
 * 处理流程：force=false 且缓存存在时读缓存并补新闻；否则执行完整刷新。
 * 读缓存与刷新共用 refreshLock，缓存存在性在锁内判断。
 */
    public List<ScreenerRow> getStocks(boolean force) throws IOException {
        synchronized (refreshLock) {
            if (!force && cache.exists()) {
                List<ScreenerRow> rows = cache.read();
                if (attachNews(rows, false)) {
                    cache.write(rows);
                }
                return rows;
            }
            List<ScreenerRow> rows = screener.scan(query);
            log.info("refresh scanned {} qualifying rows", rows.size());
            attachNews(rows, true);
            charts.generate(rows, settings.chartsDir, settings.period, settings.interval);
            cache.write(rows);
            return rows;
        }
    }

    public List<ScreenerRow> refresh() throws IOException {
        return getStocks(true);
    }

    boolean attachNews(List<ScreenerRow> rows, boolean force) {
        boolean updated = false;
        for (ScreenerRow row : rows) {
            if (!force && hasNews(row)) {
                continue;
            }
            List<Map<String, Object>> items = new ArrayList<>();
            for (NewsItem item : news.fetchRecent(row.symbol(), settings.newsLimit, settings.newsDays)) {
                items.add(item.toMap());
            }
            row.enrich(NEWS_FIELD, items);
            updated = true;
        }
        return updated;
    }

    private static boolean hasNews(ScreenerRow row) {
        Object value = row.get(NEWS_FIELD);
        return value instanceof List<?> && !((List<?>) value).isEmpty();
    }

    /**
     * Where charts go and how much history and news each refresh pulls.
     */
    public static final class Settings {
        public final Path chartsDir;
        public final String period;
        public final String interval;
        public final int newsLimit;
        public final int newsDays;

        public Settings(Path chartsDir, String period, String interval, int newsLimit, int newsDays) {
            this.chartsDir = chartsDir;
            this.period = period;
            this.interval = interval;
            this.newsLimit = newsLimit;
            this.newsDays = newsDays;
        }
    }
}
