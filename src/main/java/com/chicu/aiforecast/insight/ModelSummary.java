package com.chicu.aiforecast.insight;

import com.chicu.aiforecast.ml.eval.CandidateEvaluation;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
public record ModelSummary(
        String modelName,
        String targetKind,
        String algorithmId,
        String primaryMetric,
        double primaryScore,
        int sampleCount,
        Instant trainedAt,
        List<CandidateEvaluation> candidateScores,
        Map<String, Double> featureImportance
) {}
