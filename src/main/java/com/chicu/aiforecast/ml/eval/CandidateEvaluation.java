package com.chicu.aiforecast.ml.eval;

import lombok.Builder;
import org.jetbrains.annotations.Contract;

@Builder
public record CandidateEvaluation(
        String algorithmId,
        CandidateMetrics metrics,
        String error
) {
    @Contract(pure = true)
    public boolean ok() {
        return metrics != null && (error == null || error.isBlank());
    }
}
