package com.tightzone.screener;

import java.util.List;

/**
 * Post-scan Volatility Contraction Pattern qualification of a single row.
 * Fails closed: a missing or non-numeric input field never qualifies, and
 * nothing here throws.
 */
public final class VcpQualifier {
    public static final String CLOSE = "close";
    public static final String SMA200 = "SMA200";
    public static final String MARKET_CAP = "market_cap_basic";
    public static final String BETA = "beta_1_year";
    public static final String AVG_VOLUME_30 = "average_volume_30d_calc";

    public static final List<String> REQUIRED_COLUMNS = List.of(CLOSE, SMA200, MARKET_CAP, BETA, AVG_VOLUME_30);

    public static final String RULE_MISSING_FIELDS = "missing_fields";
    public static final String RULE_CLOSE_BELOW_SMA200 = "close_below_sma200";
    public static final String RULE_CLOSE_BELOW_FLOOR = "close_below_floor";
    public static final String RULE_MARKET_CAP_TOO_SMALL = "market_cap_too_small";
    public static final String RULE_BETA_TOO_LOW = "beta_too_low";
    public static final String RULE_DOLLAR_VOLUME_TOO_LOW = "dollar_volume_too_low";

    private static final double MIN_CLOSE = 12.0;
    private static final double MIN_MARKET_CAP = 2_000_000_000.0;
    private static final double MIN_BETA = 1.0;
    private static final double MIN_DOLLAR_VOLUME = 900_000_000.0;

    public boolean qualifies(ScreenerRow row) {
        return evaluate(row).passed;
    }

    public VcpDecision evaluate(ScreenerRow row) {
        if (row == null) {
            return VcpDecision.failed(RULE_MISSING_FIELDS);
        }
        Double close = row.number(CLOSE);
        Double sma200 = row.number(SMA200);
        Double marketCap = row.number(MARKET_CAP);
        Double beta = row.number(BETA);
        Double avgVolume = row.number(AVG_VOLUME_30);
        if (close == null || sma200 == null || marketCap == null || beta == null || avgVolume == null) {
            return VcpDecision.failed(RULE_MISSING_FIELDS);
        }

        if (!(close > sma200)) {
            return VcpDecision.failed(RULE_CLOSE_BELOW_SMA200);
        }
        if (!(close > MIN_CLOSE)) {
            return VcpDecision.failed(RULE_CLOSE_BELOW_FLOOR);
        }
        if (!(marketCap > MIN_MARKET_CAP)) {
            return VcpDecision.failed(RULE_MARKET_CAP_TOO_SMALL);
        }
        if (!(beta > MIN_BETA)) {
            return VcpDecision.failed(RULE_BETA_TOO_LOW);
        }
        if (!(close * avgVolume > MIN_DOLLAR_VOLUME)) {
            return VcpDecision.failed(RULE_DOLLAR_VOLUME_TOO_LOW);
        }
        return VcpDecision.PASSED;
    }
}
