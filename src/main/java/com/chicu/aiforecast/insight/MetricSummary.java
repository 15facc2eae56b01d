package com.chicu.aiforecast.insight;

import java.util.Arrays;

public record MetricSummary(
        double mean,
        double std,
        double min,
        double max,
        double median
) {

    public static MetricSummary of(double[] x) {
        if (x.length == 0) return new MetricSummary(0, 0, 0, 0, 0);
        double sum = 0, min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : x) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / x.length;
        double var = 0;
        for (double v : x) var += (v - mean) * (v - mean);

        double[] sorted = x.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        double median = sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;

        return new MetricSummary(mean, Math.sqrt(var / x.length), min, max, median);
    }
}
