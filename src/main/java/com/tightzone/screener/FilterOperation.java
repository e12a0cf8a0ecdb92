package com.tightzone.screener;

/**
 * Scanner filter operators, by their wire names.
 */
public enum FilterOperation {
    EQUAL("equal", true),
    NOT_EQUAL("nequal", true),
    GREATER("greater", true),
    GREATER_OR_EQUAL("egreater", true),
    LESS("less", true),
    LESS_OR_EQUAL("eless", true),
    NOT_EMPTY("nempty", false),
    EMPTY("empty", false),
    IN_RANGE("in_range", true),
    NOT_IN_RANGE("not_in_range", true),
    MATCH("match", true),
    CROSSES_ABOVE("crosses_above", true),
    CROSSES_BELOW("crosses_below", true);

    private final String wireName;
    private final boolean needsValue;

    FilterOperation(String wireName, boolean needsValue) {
        this.wireName = wireName;
        this.needsValue = needsValue;
    }

    public String wireName() {
        return wireName;
    }

    public boolean needsValue() {
        return needsValue;
    }

    public static FilterOperation fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        String target = raw.trim().toLowerCase();
        for (FilterOperation op : values()) {
            if (op.wireName.equals(target)) {
                return op;
            }
        }
        return null;
    }
}
