package com.tightzone.screener;

import com.tightzone.core.ScreenerException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a {@link ScreenerQuery} into the provider request for one page range.
 */
public final class FilterBuilder {
    static final String EXCHANGE_FIELD = "exchange";
    static final String PRICE_FIELD = "close";
    static final String VOLUME_FIELD = "volume";

    public ScreenerRequest build(ScreenerQuery query, PageRange range) {
        String market = MarketSlugs.normalize(query.getMarket());
        List<String> symbolTypes = MarketSlugs.resolveSymbolTypes(market, query.getSymbolTypes());
        List<String> columns = resolveColumns(query.getColumns(), query.isApplyVcpFilter());
        List<FilterCondition> filters = materializeFilters(query);
        return new ScreenerRequest(market, symbolTypes, columns, filters, query.getSort(), query.getLang(), range);
    }

    public ScreenerRequest build(ScreenerQuery query, int start, int end) {
        return build(query, new PageRange(start, end));
    }

    static List<FilterCondition> materializeFilters(ScreenerQuery query) {
        List<FilterCondition> out = new ArrayList<>();
        if (query.getExchange().isPresent()) {
            String exchange = query.getExchange().get().trim();
            if (exchange.isEmpty()) {
                throw ScreenerException.invalidInput("exchange must not be empty when given");
            }
            out.add(FilterCondition.of(EXCHANGE_FIELD, FilterOperation.EQUAL, exchange.toUpperCase(Locale.ROOT)));
        }
        query.getMinPrice().ifPresent(v -> out.add(FilterCondition.of(PRICE_FIELD, FilterOperation.GREATER, v)));
        query.getMaxPrice().ifPresent(v -> out.add(FilterCondition.of(PRICE_FIELD, FilterOperation.LESS, v)));
        query.getMinVolume().ifPresent(v -> out.add(FilterCondition.of(VOLUME_FIELD, FilterOperation.GREATER, v)));
        if (query.getCustomFilters() != null) {
            out.addAll(query.getCustomFilters());
        }
        return out;
    }

    // Membership check only: "Close" and "close" are different columns to the provider.
    static List<String> resolveColumns(List<String> requested, boolean applyVcpFilter) {
        List<String> out = new ArrayList<>(requested == null ? List.of() : requested);
        if (applyVcpFilter) {
            for (String required : VcpQualifier.REQUIRED_COLUMNS) {
                if (!out.contains(required)) {
                    out.add(required);
                }
            }
        }
        return out;
    }
}
