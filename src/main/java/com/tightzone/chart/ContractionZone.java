package com.tightzone.chart;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Inclusive index window of a price series with its close-price high and low.
 */
public final class ContractionZone {
    public final int startIndex;
    public final int endIndex;
    public final double high;
    public final double low;

    public ContractionZone(int startIndex, int endIndex, double high, double low) {
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.high = high;
        this.low = low;
    }

    public double range() {
        return high - low;
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("start", startIndex)
                .put("end", endIndex)
                .put("high", high)
                .put("low", low)
                .put("range", range());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContractionZone)) return false;
        ContractionZone other = (ContractionZone) o;
        return startIndex == other.startIndex
                && endIndex == other.endIndex
                && Double.compare(high, other.high) == 0
                && Double.compare(low, other.low) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startIndex, endIndex, high, low);
    }

    @Override
    public String toString() {
        return "[" + startIndex + ".." + endIndex + "] " + low + "-" + high;
    }
}
