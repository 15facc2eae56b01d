package com.chicu.aiforecast.insight;

import com.chicu.aiforecast.config.TrainingProperties;
import com.chicu.aiforecast.ml.ModelTarget;
import com.chicu.aiforecast.ml.registry.ModelArtifact;
import com.chicu.aiforecast.ml.registry.ModelRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class RecommendationRules {

    static final String RERUN_COLLECTION = "rerun_collection";
    static final String DEGRADED_SOURCE = "degraded_source";
    static final String INSUFFICIENT_SAMPLES = "insufficient_samples";
    static final String NO_MODEL = "no_model";

    private RecommendationRules() {
    }

    static List<Recommendation> evaluate(Map<String, SourceSummary> sources,
                                         ModelRegistry registry,
                                         TrainingProperties training,
                                         double nearMinimumFactor) {
        List<Recommendation> out = new ArrayList<>();

        for (SourceSummary s : sources.values()) {
            if (!s.available()) {
                out.add(new Recommendation(RERUN_COLLECTION, s.source(),
                        "Нет снапшота " + s.source() + ": запустите сбор данных"));
                continue;
            }
            if (s.stale()) {
                out.add(new Recommendation(RERUN_COLLECTION, s.source(),
                        "Данные " + s.source() + " устарели (collectedAt=" + s.collectedAt() + "): перезапустите сбор"));
            }
            if (s.degraded()) {
                out.add(new Recommendation(DEGRADED_SOURCE, s.source(),
                        "Источник " + s.source() + " в деградированном режиме: " + s.degradedReason()));
            }
        }

        for (ModelTarget t : ModelTarget.values()) {
            Optional<ModelArtifact> a = registry.find(t.modelName());
            if (a.isEmpty()) {
                out.add(new Recommendation(NO_MODEL, t.modelName(),
                        "Модель " + t.modelName() + " не обучена"));
                continue;
            }
            int min = t.minSamples(training.getMinSamples());
            if (a.get().sampleCount() < nearMinimumFactor * min) {
                out.add(new Recommendation(INSUFFICIENT_SAMPLES, t.modelName(),
                        "Мало данных для " + t.modelName() + ": samples=" + a.get().sampleCount() + " min=" + min));
            }
        }
        return out;
    }
}
