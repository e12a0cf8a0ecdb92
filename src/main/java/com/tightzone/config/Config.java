package com.tightzone.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：合并内置默认值、classpath 下的 config.properties 与工作目录下的覆盖文件。
 * 使用建议：新增配置项时同步在 buildDefaults 中登记默认值。
 */
public final class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置。
 * 处理流程：先读 classpath 资源，再用工作目录下的同名文件覆盖。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            log.warn("failed to read classpath config.properties: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            Properties overrides = new Properties();
            try (InputStream in = Files.newInputStream(local)) {
                overrides.load(in);
                config.props.putAll(overrides);
            } catch (IOException e) {
                log.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Config backed by the given values only, on top of the defaults.
     */
    public static Config of(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    config.props.setProperty(entry.getKey(), entry.getValue());
                }
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

/**
 * 方法说明：getString，负责获取配置值；空白值回退到默认值。
 */
    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

/**
 * 方法说明：getList，负责按逗号或分号切分配置值。
 */
    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("http.user-agent", "TightZone/1.0");

        defaults.put("screener.market", "america");
        defaults.put("screener.endpoint", "https://scanner.tradingview.com/%s/scan");
        defaults.put("screener.page-size", "150");
        defaults.put("screener.lang", "en");
        defaults.put("screener.timeout-sec", "20");
        defaults.put("screener.columns", "name,close,volume,market_cap_basic,beta_1_year,SMA200,Perf.W,Perf.1M,Perf.Y");

        defaults.put("history.endpoint", "https://query1.finance.yahoo.com/v8/finance/chart/");
        defaults.put("history.period", "6mo");
        defaults.put("history.interval", "1d");
        defaults.put("history.timeout-sec", "10");

        defaults.put("chart.dir", "charts");
        defaults.put("chart.threads", "4");
        defaults.put("chart.width", "1200");
        defaults.put("chart.height", "720");

        defaults.put("news.endpoint", "https://query1.finance.yahoo.com/v1/finance/search");
        defaults.put("news.limit", "3");
        defaults.put("news.days", "3");
        defaults.put("news.cache-ttl-min", "30");
        defaults.put("news.timeout-sec", "5");

        defaults.put("api.port", "5000");
        defaults.put("api.cache-file", "vcp_stocks_cache.json");

        return Collections.unmodifiableMap(defaults);
    }
}
