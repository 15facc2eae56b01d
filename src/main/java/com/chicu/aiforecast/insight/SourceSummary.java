package com.chicu.aiforecast.insight;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record SourceSummary(
        String source,
        boolean available,
        int recordCount,
        int droppedRecords,
        Instant collectedAt,
        boolean degraded,
        String degradedReason,
        boolean stale,
        Map<String, MetricSummary> metrics,
        String error
) {}
