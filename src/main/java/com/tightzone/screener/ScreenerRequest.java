package com.tightzone.screener;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * One scanner request. The static parts (market, columns, filters, sort) are
 * shared by every page; {@link #withRange} produces the per-page copy.
 */
public final class ScreenerRequest {
    public final String market;
    public final List<String> symbolTypes;
    public final List<String> columns;
    public final List<FilterCondition> filters;
    public final SortSpec sort;
    public final String lang;
    public final PageRange range;

    public ScreenerRequest(
            String market,
            List<String> symbolTypes,
            List<String> columns,
            List<FilterCondition> filters,
            SortSpec sort,
            String lang,
            PageRange range
    ) {
        this.market = market;
        this.symbolTypes = symbolTypes == null ? List.of() : List.copyOf(symbolTypes);
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        this.filters = filters == null ? List.of() : List.copyOf(filters);
        this.sort = sort;
        this.lang = lang == null || lang.isBlank() ? "en" : lang.trim();
        this.range = range == null ? new PageRange(0, 0) : range;
    }

    public ScreenerRequest withRange(int start, int end) {
        return new ScreenerRequest(market, symbolTypes, columns, filters, sort, lang, new PageRange(start, end));
    }

    public JSONObject toPayload() {
        JSONArray filterArr = new JSONArray();
        for (FilterCondition filter : filters) {
            filterArr.put(filter.toJson());
        }
        JSONObject payload = new JSONObject();
        payload.put("markets", new JSONArray().put(market));
        payload.put("symbols", new JSONObject()
                .put("query", new JSONObject().put("types", new JSONArray(symbolTypes)))
                .put("tickers", new JSONArray()));
        payload.put("columns", new JSONArray(columns));
        payload.put("filter", filterArr);
        if (sort != null) {
            payload.put("sort", sort.toJson());
        }
        payload.put("options", new JSONObject().put("lang", lang));
        payload.put("range", range.toJson());
        return payload;
    }
}
