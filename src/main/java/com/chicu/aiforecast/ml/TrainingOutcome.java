package com.chicu.aiforecast.ml;

import com.chicu.aiforecast.ml.registry.ModelArtifact;

import java.util.List;
import java.util.Map;

/**
 * Итог обучения по всем целям. failed: modelName → причина (цели изолированы друг от друга).
 */
public record TrainingOutcome(
        List<ModelArtifact> trained,
        Map<String, String> failed
) {
    public TrainingOutcome {
        trained = List.copyOf(trained);
        failed = Map.copyOf(failed);
    }
}
