package com.chicu.aiforecast.insight;

import com.chicu.aiforecast.common.enums.TrendDirection;

/**
 * Наклон МНК по индексу записи (x = 0..n-1).
 */
public final class TrendAnalyzer {

    private static final double EPS = 1e-9;

    private TrendAnalyzer() {
    }

    public static double slope(double[] y) {
        int n = y.length;
        if (n < 2) return 0.0;
        double xMean = (n - 1) / 2.0;
        double yMean = 0;
        for (double v : y) yMean += v;
        yMean /= n;

        double num = 0, den = 0;
        for (int i = 0; i < n; i++) {
            num += (i - xMean) * (y[i] - yMean);
            den += (i - xMean) * (i - xMean);
        }
        return den == 0 ? 0.0 : num / den;
    }

    /**
     * stable, если |slope| / max(|mean|, ε) ниже порога.
     */
    public static TrendDirection direction(double slope, double mean, double stableThreshold) {
        double relative = Math.abs(slope) / Math.max(Math.abs(mean), EPS);
        if (slope == 0 || relative < stableThreshold) return TrendDirection.STABLE;
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    public static MetricTrend analyze(double[] y, double stableThreshold) {
        MetricSummary s = MetricSummary.of(y);
        double slope = slope(y);
        return MetricTrend.builder()
                .direction(direction(slope, s.mean(), stableThreshold))
                .currentValue(y.length > 0 ? y[y.length - 1] : 0.0)
                .averageValue(s.mean())
                .magnitude(Math.abs(slope))
                .slope(slope)
                .min(s.min())
                .max(s.max())
                .samples(y.length)
                .build();
    }
}
