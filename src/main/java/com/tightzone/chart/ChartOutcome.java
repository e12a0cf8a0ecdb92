package com.tightzone.chart;

import java.nio.file.Path;

/**
 * Result of one symbol's chart task: either the written file or the reason
 * there is none.
 */
public final class ChartOutcome {
    public final String symbol;
    public final Path chart;
    public final boolean success;
    public final String error;

    private ChartOutcome(String symbol, Path chart, boolean success, String error) {
        this.symbol = symbol;
        this.chart = chart;
        this.success = success;
        this.error = error == null ? "" : error;
    }

    public static ChartOutcome success(String symbol, Path chart) {
        return new ChartOutcome(symbol, chart, true, "");
    }

    public static ChartOutcome failed(String symbol, String error) {
        return new ChartOutcome(symbol, null, false, error);
    }
}
