package com.tightzone.screener;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Caller-facing description of a scan. The optional thresholds are Absent or
 * Present; an absent one adds no condition at all.
 */
@Getter
@Builder(toBuilder = true)
public final class ScreenerQuery {
    @Builder.Default
    private final String market = "america";
    @Builder.Default
    private final Optional<String> exchange = Optional.empty();
    @Builder.Default
    private final OptionalDouble minPrice = OptionalDouble.empty();
    @Builder.Default
    private final OptionalDouble maxPrice = OptionalDouble.empty();
    @Builder.Default
    private final OptionalDouble minVolume = OptionalDouble.empty();
    @Builder.Default
    private final List<FilterCondition> customFilters = List.of();
    @Builder.Default
    private final List<String> columns = ScreenerPresets.DEFAULT_COLUMNS;
    @Builder.Default
    private final Optional<List<String>> symbolTypes = Optional.empty();
    @Builder.Default
    private final SortSpec sort = ScreenerPresets.DEFAULT_SORT;
    @Builder.Default
    private final String lang = "en";
    private final boolean applyVcpFilter;
}
