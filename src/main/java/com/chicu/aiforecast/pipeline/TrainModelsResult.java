package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.common.enums.RunStatus;
import com.chicu.aiforecast.ml.eval.CandidateMetrics;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
public record TrainModelsResult(
        RunStatus status,
        Instant startedAt,
        Instant finishedAt,
        List<String> modelsTrained,
        Map<String, CandidateMetrics> perModelMetrics,
        Map<String, String> failedModels,
        List<String> errors
) {
    static TrainModelsResult busy(Instant now) {
        return TrainModelsResult.builder()
                .status(RunStatus.BUSY)
                .startedAt(now)
                .finishedAt(now)
                .modelsTrained(List.of())
                .perModelMetrics(Map.of())
                .failedModels(Map.of())
                .errors(List.of("pipeline run already in progress"))
                .build();
    }
}
