package com.tightzone.chart;

import com.tightzone.core.ScreenerException;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：ContractionZoneDetector（class）。
 * 主要职责：把价格序列的尾部切成等宽窗口，找出收盘价波动区间逐段收窄的窗口。
 * 使用建议：结果只用于图表标注；采用单次贪心遍历，窗口只和上一个被选中的窗口比较。
 */
public final class ContractionZoneDetector {
    public static final int DEFAULT_SEGMENTS = 4;
    private static final int MIN_POINTS_PER_SEGMENT = 5;

    public List<ContractionZone> detect(List<PriceBar> series) {
        return detect(series, DEFAULT_SEGMENTS);
    }

/**
 * 方法说明：detect，负责识别收缩区间。
 * 处理流程：数据点少于 segmentCount*5 时返回空列表；窗口从序列末端对齐，少于 2 个点的窗口跳过；
 * 只保留区间大于 0 且严格小于上一个入选窗口的窗口。
 */
    public List<ContractionZone> detect(List<PriceBar> series, int segmentCount) {
        if (segmentCount < 1) {
            throw ScreenerException.invalidInput("segment count must be at least 1, got " + segmentCount);
        }
        int n = series == null ? 0 : series.size();
        if (n < segmentCount * MIN_POINTS_PER_SEGMENT) {
            return List.of();
        }
        int window = Math.max(n / segmentCount, 1);
        int startOffset = Math.max(n - segmentCount * window, 0);

        List<ContractionZone> zones = new ArrayList<>();
        Double previousRange = null;
        for (int i = 0; i < segmentCount; i++) {
            int start = startOffset + i * window;
            int end = Math.min(start + window, n);
            if (end - start < 2) {
                continue;
            }
            double high = Double.NEGATIVE_INFINITY;
            double low = Double.POSITIVE_INFINITY;
            for (int j = start; j < end; j++) {
                double close = series.get(j).close;
                high = Math.max(high, close);
                low = Math.min(low, close);
            }
            double range = high - low;
            if (!(range > 0)) {
                continue;
            }
            if (previousRange == null || range < previousRange) {
                zones.add(new ContractionZone(start, end - 1, high, low));
                previousRange = range;
            }
        }
        return zones;
    }
}
