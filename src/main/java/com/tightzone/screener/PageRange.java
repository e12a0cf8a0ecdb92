package com.tightzone.screener;

import org.json.JSONArray;

/**
 * Inclusive, zero-based row range. An inverted or negative range collapses to
 * a zero-width range at {@code start}.
 */
public final class PageRange {
    public final int start;
    public final int end;

    public PageRange(int start, int end) {
        this.start = Math.max(0, start);
        this.end = Math.max(this.start, end);
    }

    public JSONArray toJson() {
        return new JSONArray().put(start).put(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageRange)) return false;
        PageRange other = (PageRange) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
