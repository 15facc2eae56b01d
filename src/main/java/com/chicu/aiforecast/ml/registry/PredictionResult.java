package com.chicu.aiforecast.ml.registry;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * label/confidence заполняются только для классификации.
 */
@Builder
public record PredictionResult(
        String modelName,
        double prediction,
        String label,
        Double confidence,
        String algorithmId,
        List<String> featuresUsed,
        Instant timestamp
) {}
