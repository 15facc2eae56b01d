package com.chicu.aiforecast.insight;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record TrendReport(
        String source,
        int windowDays,
        Instant from,
        Instant to,
        Map<String, MetricTrend> perMetric
) {}
