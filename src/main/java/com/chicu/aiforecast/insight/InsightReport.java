package com.chicu.aiforecast.insight;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
public record InsightReport(
        Instant generatedAt,
        Map<String, SourceSummary> perSourceSummary,
        Map<String, ModelSummary> perModelSummary,
        List<Recommendation> recommendations
) {}
