package com.tightzone.screener;

import java.util.List;

public final class ScreenerPresets {
    public static final List<String> DEFAULT_COLUMNS = List.of(
            "name",
            "close",
            "volume",
            "market_cap_basic",
            "beta_1_year",
            "SMA200",
            "Perf.W",
            "Perf.1M",
            "Perf.Y"
    );

    public static final SortSpec DEFAULT_SORT = SortSpec.desc("market_cap_basic");

    // Established, profitable, reasonably priced names with low one-year beta.
    public static final List<FilterCondition> QUALITY_FILTERS = List.of(
            FilterCondition.of("close", FilterOperation.GREATER, "SMA200"),
            FilterCondition.of("close", FilterOperation.GREATER, 12),
            FilterCondition.of("market_cap_basic", FilterOperation.GREATER, 2_000_000_000L),
            FilterCondition.of("average_volume_90d_calc", FilterOperation.GREATER, 900_000),
            FilterCondition.of("earnings_per_share_diluted_growth_ttm", FilterOperation.GREATER, 0),
            FilterCondition.of("return_on_equity_ttm", FilterOperation.GREATER, 0),
            FilterCondition.of("pe_basic_excl_extra_ttm", FilterOperation.LESS, 80),
            FilterCondition.of("pe_basic_excl_extra_ttm", FilterOperation.NOT_EMPTY),
            FilterCondition.of("peg_ratio", FilterOperation.LESS, 2),
            FilterCondition.of("beta_1_year", FilterOperation.LESS, 1)
    );

    public static final List<String> QUALITY_COLUMNS = List.of(
            "name",
            "close",
            "SMA200",
            "market_cap_basic",
            "average_volume_90d_calc",
            "beta_1_year",
            "pe_basic_excl_extra_ttm",
            "peg_ratio",
            "earnings_per_share_diluted_growth_ttm",
            "return_on_equity_ttm"
    );

    private ScreenerPresets() {
    }
}
