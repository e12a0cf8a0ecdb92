package com.tightzone.chart;

import com.tightzone.core.ScreenerException;
import com.tightzone.screener.ScreenerRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 模块说明：ChartGenerator（class）。
 * 主要职责：为一批扫描结果并发拉取价格历史并绘图，把 chart 或 chart_error 写回对应行。
 * 使用建议：单个代码失败只影响该行；写回行的动作全部在调用线程完成。
 */
public class ChartGenerator {
    private static final Logger log = LogManager.getLogger(ChartGenerator.class);

    public static final String CHART_FIELD = "chart";
    public static final String CHART_ERROR_FIELD = "chart_error";
    public static final String NO_HISTORY = "No price history";

    private final PriceHistoryClient history;
    private final ChartRenderer renderer;
    private final int threads;

    public ChartGenerator(PriceHistoryClient history, ChartRenderer renderer, int threads) {
        this.history = history;
        this.renderer = renderer;
        this.threads = Math.max(1, threads);
    }

    /**
     * File name of a symbol's chart: the ticker after any exchange prefix, with '/' replaced.
     */
    public static String chartFileName(String symbol) {
        return PriceHistoryClient.normalizeSymbol(symbol).replace("/", "_") + ".png";
    }

/**
 * 方法说明：generate，负责批量生成图表。
 * 处理流程：每个代码一个任务提交到固定线程池；按完成顺序收集结果，最后按行顺序写回并返回。
 */
    public Map<String, ChartOutcome> generate(List<ScreenerRow> rows, Path dir, String period, String interval) throws IOException {
        Files.createDirectories(dir);
        List<ScreenerRow> targets = new ArrayList<>();
        for (ScreenerRow row : rows == null ? List.<ScreenerRow>of() : rows) {
            if (row != null && !row.symbol().isBlank()) {
                targets.add(row);
            }
        }
        Map<String, ChartOutcome> done = new LinkedHashMap<>();
        if (targets.isEmpty()) {
            return done;
        }

        int poolSize = Math.max(1, Math.min(threads, targets.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<ChartOutcome> completion = new ExecutorCompletionService<>(pool);
        try {
            for (ScreenerRow row : targets) {
                String symbol = row.symbol();
                completion.submit(() -> renderOne(symbol, dir, period, interval));
            }
            for (int i = 0; i < targets.size(); i++) {
                Future<ChartOutcome> future = completion.take();
                try {
                    ChartOutcome outcome = future.get();
                    done.put(outcome.symbol, outcome);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("chart task failed err={}", cause.toString());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ScreenerException.cancelled("chart generation interrupted");
        } finally {
            pool.shutdownNow();
        }

        Map<String, ChartOutcome> ordered = new LinkedHashMap<>();
        for (ScreenerRow row : targets) {
            ChartOutcome outcome = done.getOrDefault(row.symbol(), ChartOutcome.failed(row.symbol(), "chart task failed"));
            if (outcome.success) {
                row.enrich(CHART_FIELD, outcome.chart.toString());
            } else {
                row.enrich(CHART_ERROR_FIELD, outcome.error);
            }
            ordered.put(row.symbol(), outcome);
        }
        log.info("charts written={} failed={} dir={}",
                ordered.values().stream().filter(o -> o.success).count(),
                ordered.values().stream().filter(o -> !o.success).count(),
                dir);
        return ordered;
    }

    ChartOutcome renderOne(String symbol, Path dir, String period, String interval) {
        try {
            List<PriceBar> series = history.fetch(symbol, period, interval);
            if (series.isEmpty()) {
                return ChartOutcome.failed(symbol, NO_HISTORY);
            }
            Path out = dir.resolve(chartFileName(symbol));
            renderer.render(symbol, series, out);
            return ChartOutcome.success(symbol, out);
        } catch (ScreenerException | IOException | IllegalArgumentException e) {
            log.warn("chart failed symbol={} err={}", symbol, e.getMessage());
            return ChartOutcome.failed(symbol, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }
}
