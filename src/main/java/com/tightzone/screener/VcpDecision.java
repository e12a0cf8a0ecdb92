package com.tightzone.screener;

public final class VcpDecision {
    static final VcpDecision PASSED = new VcpDecision(true, "");

    public final boolean passed;
    public final String failedRule;

    private VcpDecision(boolean passed, String failedRule) {
        this.passed = passed;
        this.failedRule = failedRule == null ? "" : failedRule;
    }

    static VcpDecision failed(String rule) {
        return new VcpDecision(false, rule);
    }
}
