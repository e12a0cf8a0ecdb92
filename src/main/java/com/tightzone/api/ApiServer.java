package com.tightzone.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.tightzone.chart.ChartGenerator;
import com.tightzone.screener.ScreenerRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP front end for the VCP viewer.
 *
 * Endpoints:
 *   GET /api/stocks                 - cached qualifying stocks
 *   GET /api/stocks/{symbol}/chart  - chart PNG, 404 when not rendered
 *   GET /api/refresh                - rescan, rebuild charts and cache
 *   GET /api/health                 - liveness
 */
public class ApiServer {
    private static final Logger log = LogManager.getLogger(ApiServer.class);

    private static final String STOCKS_PREFIX = "/api/stocks/";
    private static final String CHART_SUFFIX = "/chart";

    private final StockService service;
    private final int requestedPort;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(StockService service, int port) {
        this.service = service;
        this.requestedPort = port;
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            return;
        }
        server = HttpServer.create(new InetSocketAddress(requestedPort), 0);
        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.createContext("/api/stocks", this::handleStocks);
        server.createContext("/api/refresh", this::handleRefresh);
        server.createContext("/api/health", this::handleHealth);
        server.start();
        log.info("API server listening on port {}", port());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    public synchronized int port() {
        return server == null ? requestedPort : server.getAddress().getPort();
    }

    private void handleStocks(HttpExchange exchange) throws IOException {
        if (preflight(exchange)) {
            return;
        }
        String path = exchange.getRequestURI().getPath();
        if (path.startsWith(STOCKS_PREFIX) && path.endsWith(CHART_SUFFIX)) {
            String symbol = path.substring(STOCKS_PREFIX.length(), path.length() - CHART_SUFFIX.length());
            handleChart(exchange, URLDecoder.decode(symbol, StandardCharsets.UTF_8));
            return;
        }
        if (!"/api/stocks".equals(path) && !"/api/stocks/".equals(path)) {
            sendJson(exchange, 404, new JSONObject().put("error", "Not found").toString());
            return;
        }
        try {
            List<ScreenerRow> rows = service.getStocks(false);
            JSONArray arr = new JSONArray();
            for (ScreenerRow row : rows) {
                arr.put(row.toJson());
            }
            sendJson(exchange, 200, arr.toString());
        } catch (Exception e) {
            log.error("GET /api/stocks failed", e);
            sendError(exchange, e);
        }
    }

    private void handleChart(HttpExchange exchange, String symbol) throws IOException {
        Path chart = service.chartsDir().resolve(ChartGenerator.chartFileName(symbol)).normalize();
        if (symbol.isBlank() || !chart.startsWith(service.chartsDir().normalize()) || !Files.isRegularFile(chart)) {
            sendJson(exchange, 404, new JSONObject().put("error", "Chart not found").toString());
            return;
        }
        byte[] png = Files.readAllBytes(chart);
        exchange.getResponseHeaders().set("Content-Type", "image/png");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, png.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(png);
        }
    }

    private void handleRefresh(HttpExchange exchange) throws IOException {
        if (preflight(exchange)) {
            return;
        }
        try {
            List<ScreenerRow> rows = service.refresh();
            sendJson(exchange, 200, new JSONObject()
                    .put("message", "Data refreshed")
                    .put("count", rows.size())
                    .toString());
        } catch (Exception e) {
            log.error("GET /api/refresh failed", e);
            sendError(exchange, e);
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (preflight(exchange)) {
            return;
        }
        sendJson(exchange, 200, new JSONObject().put("status", "ok").toString());
    }

    private boolean preflight(HttpExchange exchange) throws IOException {
        if (!"OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            return false;
        }
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
        exchange.sendResponseHeaders(204, -1);
        exchange.close();
        return true;
    }

    private void sendError(HttpExchange exchange, Exception e) throws IOException {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        sendJson(exchange, 500, new JSONObject().put("error", message).toString());
    }

    private void sendJson(HttpExchange exchange, int status, String json) throws IOException {
        byte[] response = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }
}
