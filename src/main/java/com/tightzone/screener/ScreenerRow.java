package com.tightzone.screener;

import com.tightzone.core.ScreenerException;
import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 模块说明：ScreenerRow（class）。
 * 主要职责：保存一行扫描结果，列名到取值（字符串、数字或 null）的有序映射，外加必填的 symbol。
 * 使用建议：除图表与新闻等展示字段外，行在创建后不应再修改。
 */
public final class ScreenerRow {
    public static final String SYMBOL = "symbol";

    // Plain decimal with optional exponent; no type suffixes, hex floats or named values.
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final String symbol;
    private final Map<String, Object> values;

    public ScreenerRow(String symbol, Map<String, Object> values) {
        if (symbol == null || symbol.trim().isEmpty()) {
            throw ScreenerException.decode("row without symbol");
        }
        this.symbol = symbol.trim();
        this.values = new LinkedHashMap<>();
        if (values != null) {
            for (Map.Entry<String, Object> entry : values.entrySet()) {
                if (entry.getKey() != null && !SYMBOL.equals(entry.getKey())) {
                    this.values.put(entry.getKey(), normalizeValue(entry.getValue()));
                }
            }
        }
    }

/**
 * 方法说明：zip，负责按列顺序把取值数组装配为行。
 * 处理流程：取值数组短于列表时，缺失的尾部列填 null；多余取值忽略。
 */
    public static ScreenerRow zip(String symbol, List<String> columns, JSONArray values) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Object value = values != null && i < values.length() ? values.opt(i) : null;
            out.put(columns.get(i), value);
        }
        return new ScreenerRow(symbol, out);
    }

    public static ScreenerRow fromJson(JSONObject obj) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : obj.keySet()) {
            out.put(key, obj.opt(key));
        }
        return new ScreenerRow(obj.optString(SYMBOL, ""), out);
    }

    public String symbol() {
        return symbol;
    }

    public synchronized Object get(String column) {
        return values.get(column);
    }

    public synchronized boolean has(String column) {
        return values.containsKey(column);
    }

    public synchronized Set<String> columns() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values.keySet()));
    }

    /**
     * Finite numeric value of a column: numbers and numeric strings count,
     * booleans, NaN and infinities do not.
     */
    public Double number(String column) {
        return toFiniteDouble(get(column));
    }

    /**
     * Display-only enrichment (chart path, chart error, news).
     */
    public synchronized void enrich(String key, Object value) {
        if (key == null || SYMBOL.equals(key)) {
            return;
        }
        values.put(key, value);
    }

    public synchronized JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put(SYMBOL, symbol);
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            obj.put(entry.getKey(), entry.getValue() == null ? JSONObject.NULL : entry.getValue());
        }
        return obj;
    }

    @Override
    public synchronized String toString() {
        return symbol + values;
    }

    static Double toFiniteDouble(Object value) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            String trimmed = s.trim();
            if (!PLAIN_NUMBER.matcher(trimmed).matches()) {
                return null;
            }
            d = Double.parseDouble(trimmed);
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }

    private static Object normalizeValue(Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        if (value instanceof BigDecimal bd) {
            return bd.doubleValue();
        }
        if (value instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? (Object) bi.longValue() : bi.doubleValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof Number || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof JSONArray arr) {
            return arr.toList();
        }
        if (value instanceof JSONObject obj) {
            return obj.toMap();
        }
        if (value instanceof List<?> || value instanceof Map<?, ?>) {
            return value;
        }
        return String.valueOf(value);
    }
}
