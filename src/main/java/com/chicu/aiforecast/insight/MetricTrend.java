package com.chicu.aiforecast.insight;

import com.chicu.aiforecast.common.enums.TrendDirection;
import lombok.Builder;

/**
 * magnitude = |slope| (изменение метрики за одну запись).
 */
@Builder
public record MetricTrend(
        TrendDirection direction,
        double currentValue,
        double averageValue,
        double magnitude,
        double slope,
        double min,
        double max,
        int samples
) {}
