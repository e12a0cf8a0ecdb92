package com.tightzone.app;

import com.tightzone.api.ApiServer;
import com.tightzone.chart.ChartGenerator;
import com.tightzone.chart.ChartRenderer;
import com.tightzone.chart.ContractionZone;
import com.tightzone.chart.ContractionZoneDetector;
import com.tightzone.chart.PriceBar;
import com.tightzone.chart.PriceHistoryClient;
import com.tightzone.config.Config;
import com.tightzone.core.ScreenerException;
import com.tightzone.data.http.HttpClientEx;
import com.tightzone.news.NewsFetcher;
import com.tightzone.news.NewsItem;
import com.tightzone.screener.FilterCondition;
import com.tightzone.screener.ScannerTransport;
import com.tightzone.screener.Screener;
import com.tightzone.screener.ScreenerPresets;
import com.tightzone.screener.ScreenerQuery;
import com.tightzone.screener.ScreenerRow;
import com.tightzone.screener.TradingViewScannerTransport;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;
import org.json.JSONObject;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;

public final class TightZoneApplication {
    private static final Logger log = LogManager.getLogger(TightZoneApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final PrintStream out;
    private final PrintStream err;
    private final Function<Config, ScannerTransport> transportFactory;

    public TightZoneApplication() {
        this(System.out, System.err, null);
    }

    TightZoneApplication(PrintStream out, PrintStream err, Function<Config, ScannerTransport> transportFactory) {
        this.out = out;
        this.err = err;
        this.transportFactory = transportFactory;
    }

    public static void main(String[] args) {
        int exit = new TightZoneApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            printHelp(options);
            err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            printHelp(options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        try {
            if (cmd.hasOption("serve")) {
                return runServe(config);
            }
            if (cmd.hasOption("zones")) {
                return runZones(cmd.getOptionValue("zones"), config);
            }

            ScreenerQuery query;
            int pageSize;
            try {
                query = buildQuery(cmd, config);
                pageSize = parseInt(cmd, "page-size", config.getInt("screener.page-size", Screener.DEFAULT_PAGE_SIZE));
            } catch (NumberFormatException e) {
                printHelp(options);
                err.println("ERROR: not a number: " + e.getMessage());
                return 2;
            }

            Screener screener = new Screener(transport(config), pageSize);
            if (cmd.hasOption("dump-payload")) {
                out.println(screener.payload(query, 0, pageSize - 1).toString(2));
                return 0;
            }
            return runScan(cmd, config, screener, query);
        } catch (ScreenerException e) {
            err.println("ERROR: " + e.toSingleLine());
            return 1;
        } catch (IOException e) {
            err.println("ERROR: io: " + e.getMessage());
            return 1;
        }
    }

/**
 * 方法说明：runScan，负责执行一次扫描并逐行输出 JSON。
 * 处理流程：可选地补充新闻与生成图表，之后每行一个 JSON 对象写到标准输出。
 */
    private int runScan(CommandLine cmd, Config config, Screener screener, ScreenerQuery query) throws IOException {
        List<ScreenerRow> rows = screener.scan(query);
        log.info("scan returned {} rows market={} vcp={}", rows.size(), query.getMarket(), query.isApplyVcpFilter());

        HttpClientEx http = new HttpClientEx(config.getString("http.user-agent"));
        if (cmd.hasOption("news")) {
            NewsFetcher news = newsFetcher(http, config);
            int limit = config.getInt("news.limit", 3);
            int days = config.getInt("news.days", 3);
            for (ScreenerRow row : rows) {
                List<Map<String, Object>> items = new ArrayList<>();
                for (NewsItem item : news.fetchRecent(row.symbol(), limit, days)) {
                    items.add(item.toMap());
                }
                row.enrich("news", items);
            }
        }
        if (cmd.hasOption("charts")) {
            Path dir = config.workingDir().resolve(cmd.getOptionValue("charts")).normalize();
            chartGenerator(http, config).generate(rows, dir,
                    config.getString("history.period", "6mo"),
                    config.getString("history.interval", "1d"));
        }
        for (ScreenerRow row : rows) {
            out.println(row.toJson().toString());
        }
        return 0;
    }

    private int runZones(String symbol, Config config) {
        HttpClientEx http = new HttpClientEx(config.getString("http.user-agent"));
        List<PriceBar> series = historyClient(http, config).fetch(symbol,
                config.getString("history.period", "6mo"),
                config.getString("history.interval", "1d"));
        List<ContractionZone> zones = new ContractionZoneDetector().detect(series);
        for (ContractionZone zone : zones) {
            JSONObject obj = zone.toJson();
            obj.put("from", series.get(zone.startIndex).timestamp.toString());
            obj.put("to", series.get(zone.endIndex).timestamp.toString());
            out.println(obj.toString());
        }
        log.info("{}: {} bars, {} contraction zone(s)", symbol, series.size(), zones.size());
        return 0;
    }

    private int runServe(Config config) throws IOException {
        installLogRoutingIfNeeded(config);
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TightZoneBootstrapConfig.class);
        ApiServer server = context.getBean(ApiServer.class);
        server.start();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            context.close();
            stopped.countDown();
        }, "tightzone-shutdown"));
        log.info("Endpoints: /api/stocks /api/stocks/<symbol>/chart /api/refresh /api/health on port {}", server.port());
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
            context.close();
        }
        return 0;
    }

    /**
     * Scan query from command-line options, falling back to config for the market and columns.
     */
    static ScreenerQuery buildQuery(CommandLine cmd, Config config) throws IOException {
        boolean quality = "quality".equalsIgnoreCase(cmd.getOptionValue("preset", "").trim());
        if (cmd.hasOption("preset") && !quality) {
            throw ScreenerException.invalidInput("unknown preset '" + cmd.getOptionValue("preset") + "'");
        }

        ScreenerQuery.ScreenerQueryBuilder builder = ScreenerQuery.builder()
                .market(cmd.getOptionValue("market", config.getString("screener.market", "america")))
                .lang(config.getString("screener.lang", "en"))
                .applyVcpFilter(cmd.hasOption("vcp"));

        // --exchange "" means no exchange filter
        String exchange = cmd.getOptionValue("exchange", "").trim();
        if (!exchange.isEmpty()) {
            builder.exchange(Optional.of(exchange));
        }
        builder.minPrice(parseDouble(cmd, "min-price"));
        builder.maxPrice(parseDouble(cmd, "max-price"));
        builder.minVolume(parseDouble(cmd, "min-volume"));

        List<String> columns;
        if (cmd.hasOption("columns")) {
            columns = splitList(cmd.getOptionValue("columns"));
        } else if (quality) {
            columns = ScreenerPresets.QUALITY_COLUMNS;
        } else {
            List<String> configured = config.getList("screener.columns");
            columns = configured.isEmpty() ? ScreenerPresets.DEFAULT_COLUMNS : configured;
        }
        builder.columns(columns);

        if (cmd.hasOption("symbol-types")) {
            builder.symbolTypes(Optional.of(splitList(cmd.getOptionValue("symbol-types"))));
        }

        List<FilterCondition> filters = new ArrayList<>();
        if (quality) {
            filters.addAll(ScreenerPresets.QUALITY_FILTERS);
        }
        if (cmd.hasOption("filters")) {
            Path file = config.workingDir().resolve(cmd.getOptionValue("filters")).normalize();
            filters.addAll(FilterCondition.listFromJson(Files.readString(file, StandardCharsets.UTF_8)));
        }
        builder.customFilters(filters);
        return builder.build();
    }

    private ScannerTransport transport(Config config) {
        if (transportFactory != null) {
            return transportFactory.apply(config);
        }
        HttpClientEx http = new HttpClientEx(config.getString("http.user-agent"));
        return new TradingViewScannerTransport(http,
                config.getString("screener.endpoint"),
                config.getInt("screener.timeout-sec", 20));
    }

    private static PriceHistoryClient historyClient(HttpClientEx http, Config config) {
        return new PriceHistoryClient(http,
                config.getString("history.endpoint"),
                config.getInt("history.timeout-sec", 10));
    }

    private static ChartGenerator chartGenerator(HttpClientEx http, Config config) {
        return new ChartGenerator(historyClient(http, config),
                new ChartRenderer(config.getInt("chart.width", 1200), config.getInt("chart.height", 720)),
                config.getInt("chart.threads", 4));
    }

    private static NewsFetcher newsFetcher(HttpClientEx http, Config config) {
        return new NewsFetcher(http,
                config.getString("news.endpoint"),
                config.getInt("news.timeout-sec", 5),
                Duration.ofMinutes(config.getInt("news.cache-ttl-min", 30)));
    }

    private static OptionalDouble parseDouble(CommandLine cmd, String opt) {
        if (!cmd.hasOption(opt)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(cmd.getOptionValue(opt).trim()));
    }

    private static int parseInt(CommandLine cmd, String opt, int fallback) {
        if (!cmd.hasOption(opt)) {
            return fallback;
        }
        return Integer.parseInt(cmd.getOptionValue(opt).trim());
    }

    static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "tightzone", null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TightZoneApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("tightzone.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(TightZoneApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                log.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                log.warn("failed to initialize log4j routing: {}", e.getMessage());
            }
        }
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("market").hasArg().argName("SLUG").desc("market to scan (default from config, e.g. america)").build());
        options.addOption(Option.builder().longOpt("exchange").hasArg().argName("CODE").desc("only symbols listed on this exchange").build());
        options.addOption(Option.builder().longOpt("min-price").hasArg().argName("N").desc("close greater than N").build());
        options.addOption(Option.builder().longOpt("max-price").hasArg().argName("N").desc("close less than N").build());
        options.addOption(Option.builder().longOpt("min-volume").hasArg().argName("N").desc("volume greater than N").build());
        options.addOption(Option.builder().longOpt("columns").hasArg().argName("a,b,c").desc("columns to request").build());
        options.addOption(Option.builder().longOpt("symbol-types").hasArg().argName("a,b").desc("symbol types; an empty value means no type restriction").build());
        options.addOption(Option.builder().longOpt("filters").hasArg().argName("FILE").desc("JSON array of extra filter conditions").build());
        options.addOption(Option.builder().longOpt("preset").hasArg().argName("NAME").desc("named filter preset: quality").build());
        options.addOption(Option.builder().longOpt("vcp").desc("keep only rows that pass the VCP qualifier").build());
        options.addOption(Option.builder().longOpt("page-size").hasArg().argName("N").desc("rows per page request").build());
        options.addOption(Option.builder().longOpt("dump-payload").desc("print the first page request body and exit").build());
        options.addOption(Option.builder().longOpt("charts").hasArg().argName("DIR").desc("render a chart per result row into DIR").build());
        options.addOption(Option.builder().longOpt("news").desc("attach recent news to each result row").build());
        options.addOption(Option.builder().longOpt("zones").hasArg().argName("SYMBOL").desc("print contraction zones of SYMBOL and exit").build());
        options.addOption(Option.builder().longOpt("serve").desc("start the HTTP API server").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }
}
