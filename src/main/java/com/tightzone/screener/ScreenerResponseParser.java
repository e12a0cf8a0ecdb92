package com.tightzone.screener;

import com.tightzone.core.ScreenerException;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one scanner response page into rows. The columns the response reports
 * win over the requested ones, so a provider that reorders or drops columns
 * still zips correctly.
 */
public final class ScreenerResponseParser {

    public List<ScreenerRow> parse(JSONObject response, List<String> requestColumns) {
        if (response == null) {
            throw ScreenerException.decode("missing scanner response");
        }
        Object error = response.opt("error");
        if (isTruthy(error)) {
            throw ScreenerException.providerError(String.valueOf(error));
        }

        List<String> columns = responseColumns(response, requestColumns);
        Object data = response.opt("data");
        if (data == null || JSONObject.NULL.equals(data)) {
            return List.of();
        }
        if (!(data instanceof JSONArray)) {
            throw ScreenerException.decode("'data' is not an array");
        }
        JSONArray items = (JSONArray) data;
        List<ScreenerRow> rows = new ArrayList<>(items.length());
        for (int i = 0; i < items.length(); i++) {
            Object raw = items.opt(i);
            if (!(raw instanceof JSONObject)) {
                throw ScreenerException.decode("data item " + i + " is not an object");
            }
            JSONObject item = (JSONObject) raw;
            String symbol = item.optString("s", "");
            if (symbol.isBlank()) {
                throw ScreenerException.decode("data item " + i + " has no symbol");
            }
            Object values = item.opt("d");
            if (values != null && !JSONObject.NULL.equals(values) && !(values instanceof JSONArray)) {
                throw ScreenerException.decode("values of " + symbol + " are not an array");
            }
            rows.add(ScreenerRow.zip(symbol, columns, values instanceof JSONArray ? (JSONArray) values : null));
        }
        return rows;
    }

    static List<String> responseColumns(JSONObject response, List<String> requestColumns) {
        Object raw = response.opt("columns");
        if (!(raw instanceof JSONArray)) {
            return requestColumns == null ? List.of() : requestColumns;
        }
        JSONArray arr = (JSONArray) raw;
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            out.add(arr.optString(i, ""));
        }
        return out;
    }

    static boolean isTruthy(Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof JSONArray arr) {
            return !arr.isEmpty();
        }
        if (value instanceof JSONObject obj) {
            return !obj.isEmpty();
        }
        return true;
    }
}
