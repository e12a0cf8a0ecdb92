package com.tightzone.screener;

import com.tightzone.core.FailureKind;
import com.tightzone.core.ScreenerException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterBuilderTest {
    private final FilterBuilder builder = new FilterBuilder();

    @Test
    void buildShouldMaterializeTemplatedFiltersInFixedOrder() {
        FilterCondition custom = FilterCondition.of("Perf.W", FilterOperation.GREATER, 0);
        ScreenerQuery query = ScreenerQuery.builder()
                .market("us")
                .exchange(Optional.of(" nasdaq "))
                .minPrice(OptionalDouble.of(10))
                .maxPrice(OptionalDouble.of(500))
                .minVolume(OptionalDouble.of(1_000_000))
                .customFilters(List.of(custom))
                .build();

        ScreenerRequest request = builder.build(query, 0, 49);

        assertEquals("america", request.market);
        assertEquals(List.of(
                FilterCondition.of("exchange", FilterOperation.EQUAL, "NASDAQ"),
                FilterCondition.of("close", FilterOperation.GREATER, 10.0),
                FilterCondition.of("close", FilterOperation.LESS, 500.0),
                FilterCondition.of("volume", FilterOperation.GREATER, 1_000_000.0),
                custom
        ), request.filters);
    }

    @Test
    void buildShouldAddNoConditionForAbsentThresholds() {
        ScreenerRequest request = builder.build(ScreenerQuery.builder().build(), 0, 9);
        assertTrue(request.filters.isEmpty());
        assertEquals(List.of("stock"), request.symbolTypes);
    }

    @Test
    void buildShouldDropEachAbsentThresholdIndependently() {
        FilterCondition exchange = FilterCondition.of("exchange", FilterOperation.EQUAL, "NYSE");
        FilterCondition minPrice = FilterCondition.of("close", FilterOperation.GREATER, 5.0);
        FilterCondition maxPrice = FilterCondition.of("close", FilterOperation.LESS, 50.0);
        FilterCondition minVolume = FilterCondition.of("volume", FilterOperation.GREATER, 200_000.0);

        // every present/absent combination of the four thresholds
        for (int mask = 0; mask < 16; mask++) {
            ScreenerQuery.ScreenerQueryBuilder query = ScreenerQuery.builder();
            List<FilterCondition> expected = new ArrayList<>();
            if ((mask & 1) != 0) {
                query.exchange(Optional.of("nyse"));
                expected.add(exchange);
            }
            if ((mask & 2) != 0) {
                query.minPrice(OptionalDouble.of(5));
                expected.add(minPrice);
            }
            if ((mask & 4) != 0) {
                query.maxPrice(OptionalDouble.of(50));
                expected.add(maxPrice);
            }
            if ((mask & 8) != 0) {
                query.minVolume(OptionalDouble.of(200_000));
                expected.add(minVolume);
            }

            assertEquals(expected, builder.build(query.build(), 0, 9).filters, "mask " + mask);
        }
    }

    @Test
    void buildShouldRejectBlankExchange() {
        ScreenerException e = assertThrows(ScreenerException.class,
                () -> builder.build(ScreenerQuery.builder().exchange(Optional.of(" ")).build(), 0, 9));
        assertEquals(FailureKind.INVALID_INPUT, e.kind());
    }

    @Test
    void buildShouldAppendMissingVcpColumnsInRequiredOrder() {
        ScreenerQuery query = ScreenerQuery.builder()
                .columns(List.of("name"))
                .applyVcpFilter(true)
                .build();

        ScreenerRequest request = builder.build(query, 0, 9);

        assertEquals(List.of("name", "close", "SMA200", "market_cap_basic", "beta_1_year", "average_volume_30d_calc"),
                request.columns);
    }

    @Test
    void buildShouldNotDuplicateColumnsAlreadyRequested() {
        ScreenerQuery query = ScreenerQuery.builder()
                .columns(List.of("SMA200", "name", "close"))
                .applyVcpFilter(true)
                .build();

        ScreenerRequest request = builder.build(query, 0, 9);

        assertEquals(List.of("SMA200", "name", "close", "market_cap_basic", "beta_1_year", "average_volume_30d_calc"),
                request.columns);
    }

    @Test
    void buildShouldLeaveColumnsAloneWithoutVcp() {
        ScreenerQuery query = ScreenerQuery.builder().columns(List.of("name")).build();
        assertEquals(List.of("name"), builder.build(query, 0, 9).columns);
    }

    @Test
    void buildShouldClampInvertedRange() {
        ScreenerRequest request = builder.build(ScreenerQuery.builder().build(), 10, 5);
        assertEquals(new PageRange(10, 10), request.range);
        assertEquals(new PageRange(0, 3), builder.build(ScreenerQuery.builder().build(), -4, 3).range);
    }

    @Test
    void buildShouldFailFastOnBlankMarket() {
        ScreenerException e = assertThrows(ScreenerException.class,
                () -> builder.build(ScreenerQuery.builder().market(" ").build(), 0, 9));
        assertEquals(FailureKind.INVALID_INPUT, e.kind());
    }

    @Test
    void payloadShouldCarryAllRequestParts() {
        ScreenerQuery query = ScreenerQuery.builder()
                .market("crypto")
                .columns(List.of("name", "close"))
                .minPrice(OptionalDouble.of(1))
                .build();

        JSONObject payload = builder.build(query, 0, 149).toPayload();

        assertEquals("crypto", payload.getJSONArray("markets").getString(0));
        assertEquals("crypto", payload.getJSONObject("symbols").getJSONObject("query").getJSONArray("types").getString(0));
        assertEquals(0, payload.getJSONObject("symbols").getJSONArray("tickers").length());
        assertEquals(2, payload.getJSONArray("columns").length());
        JSONObject filter = payload.getJSONArray("filter").getJSONObject(0);
        assertEquals("close", filter.getString("left"));
        assertEquals("greater", filter.getString("operation"));
        assertEquals(1.0, filter.getDouble("right"), 1e-9);
        assertEquals("market_cap_basic", payload.getJSONObject("sort").getString("sortBy"));
        assertEquals("desc", payload.getJSONObject("sort").getString("sortOrder"));
        assertEquals("en", payload.getJSONObject("options").getString("lang"));
        JSONArray range = payload.getJSONArray("range");
        assertEquals(0, range.getInt(0));
        assertEquals(149, range.getInt(1));
    }

    @Test
    void payloadShouldOmitSortWhenNotSet() {
        ScreenerQuery query = ScreenerQuery.builder().sort(null).build();
        assertFalse(builder.build(query, 0, 9).toPayload().has("sort"));
    }

    @Test
    void payloadShouldOmitRightForValuelessOperation() {
        ScreenerQuery query = ScreenerQuery.builder()
                .customFilters(List.of(FilterCondition.of("peg_ratio", FilterOperation.NOT_EMPTY)))
                .build();
        JSONObject filter = builder.build(query, 0, 9).toPayload().getJSONArray("filter").getJSONObject(0);
        assertFalse(filter.has("right"));
        assertEquals("nempty", filter.getString("operation"));
    }
}
