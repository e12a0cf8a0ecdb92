package com.tightzone.app;

import com.tightzone.api.ApiServer;
import com.tightzone.api.StockCache;
import com.tightzone.api.StockService;
import com.tightzone.app.properties.ApiProperties;
import com.tightzone.app.properties.ChartProperties;
import com.tightzone.app.properties.HistoryProperties;
import com.tightzone.app.properties.NewsProperties;
import com.tightzone.app.properties.ScreenerProperties;
import com.tightzone.chart.ChartGenerator;
import com.tightzone.chart.ChartRenderer;
import com.tightzone.chart.PriceHistoryClient;
import com.tightzone.data.http.HttpClientEx;
import com.tightzone.news.NewsFetcher;
import com.tightzone.screener.Screener;
import com.tightzone.screener.ScreenerPresets;
import com.tightzone.screener.ScreenerQuery;
import com.tightzone.screener.TradingViewScannerTransport;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
@PropertySource("classpath:config.properties")
@PropertySource(value = "file:./config.properties", ignoreResourceNotFound = true)
@EnableConfigurationProperties({
        ScreenerProperties.class,
        ApiProperties.class,
        ChartProperties.class,
        HistoryProperties.class,
        NewsProperties.class
})
public class TightZoneBootstrapConfig {

    @Bean
    public HttpClientEx httpClient(Environment environment) {
        return new HttpClientEx(environment.getProperty("http.user-agent", "TightZone/1.0"));
    }

    @Bean
    @Lazy
    public Screener screener(HttpClientEx httpClient, ScreenerProperties props) {
        TradingViewScannerTransport transport =
                new TradingViewScannerTransport(httpClient, props.getEndpoint(), props.getTimeoutSec());
        return new Screener(transport, props.getPageSize());
    }

    @Bean
    @Lazy
    public PriceHistoryClient priceHistoryClient(HttpClientEx httpClient, HistoryProperties props) {
        return new PriceHistoryClient(httpClient, props.getEndpoint(), props.getTimeoutSec());
    }

    @Bean
    @Lazy
    public ChartGenerator chartGenerator(PriceHistoryClient history, ChartProperties props) {
        return new ChartGenerator(history, new ChartRenderer(props.getWidth(), props.getHeight()), props.getThreads());
    }

    @Bean
    @Lazy
    public NewsFetcher newsFetcher(HttpClientEx httpClient, NewsProperties props) {
        return new NewsFetcher(httpClient, props.getEndpoint(), props.getTimeoutSec(),
                Duration.ofMinutes(Math.max(0, props.getCacheTtlMin())));
    }

    @Bean
    @Lazy
    public StockCache stockCache(ApiProperties props) {
        return new StockCache(workingDir().resolve(props.getCacheFile()).normalize());
    }

    @Bean
    @Lazy
    public StockService stockService(
            Screener screener,
            NewsFetcher newsFetcher,
            ChartGenerator chartGenerator,
            StockCache stockCache,
            ScreenerProperties screenerProps,
            ChartProperties chartProps,
            HistoryProperties historyProps,
            NewsProperties newsProps
    ) {
        ScreenerQuery query = ScreenerQuery.builder()
                .market(screenerProps.getMarket())
                .lang(screenerProps.getLang())
                .columns(screenerProps.getColumns() == null || screenerProps.getColumns().isEmpty()
                        ? ScreenerPresets.DEFAULT_COLUMNS
                        : screenerProps.getColumns())
                .applyVcpFilter(true)
                .build();
        StockService.Settings settings = new StockService.Settings(
                workingDir().resolve(chartProps.getDir()).normalize(),
                historyProps.getPeriod(),
                historyProps.getInterval(),
                newsProps.getLimit(),
                newsProps.getDays()
        );
        return new StockService(screener, query, newsFetcher, chartGenerator, stockCache, settings);
    }

    @Bean
    @Lazy
    public ApiServer apiServer(StockService stockService, ApiProperties props) {
        return new ApiServer(stockService, props.getPort());
    }

    private static Path workingDir() {
        return Path.of(".").toAbsolutePath().normalize();
    }
}
