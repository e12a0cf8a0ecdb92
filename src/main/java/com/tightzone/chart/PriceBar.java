package com.tightzone.chart;

import java.time.Instant;

/**
 * One point of a price history: bar time, close and volume.
 */
public final class PriceBar {
    public final Instant timestamp;
    public final double close;
    public final double volume;

    public PriceBar(Instant timestamp, double close, double volume) {
        this.timestamp = timestamp;
        this.close = close;
        this.volume = volume;
    }

    @Override
    public String toString() {
        return timestamp + " close=" + close + " volume=" + volume;
    }
}
