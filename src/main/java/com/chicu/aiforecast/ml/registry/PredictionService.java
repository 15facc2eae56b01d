package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.common.exception.FeatureMismatchException;
import com.chicu.aiforecast.common.exception.ModelNotFoundException;
import com.chicu.aiforecast.ml.eval.CrossValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Точечные предсказания. Только чтение реестра: одна ссылка на артефакт на весь запрос.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

    private final ModelRegistry registry;
    private final Clock clock;

    public PredictionResult predict(String modelName, Map<String, Double> features) {

        ModelArtifact artifact = registry.find(modelName)
                .orElseThrow(() -> new ModelNotFoundException(modelName));

        List<String> expected = artifact.featureNames();
        Map<String, Double> given = features != null ? features : Map.of();

        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String name : expected) {
            if (!given.containsKey(name)) {
                missing.add(name);
            } else {
                Double v = given.get(name);
                if (v == null || !Double.isFinite(v)) invalid.add(name);
            }
        }

        Set<String> known = new HashSet<>(expected);
        List<String> unexpected = new ArrayList<>();
        for (String key : given.keySet()) {
            if (!known.contains(key)) unexpected.add(key);
        }
        unexpected.sort(null);

        if (!missing.isEmpty() || !unexpected.isEmpty() || !invalid.isEmpty()) {
            log.debug("🔎 PREDICT REJECT model={} missing={} unexpected={} invalid={}",
                    modelName, missing, unexpected, invalid);
            throw new FeatureMismatchException(modelName, missing, unexpected, invalid);
        }

        double[] x = new double[expected.size()];
        for (int i = 0; i < x.length; i++) x[i] = given.get(expected.get(i));

        double[] out = artifact.params().predictRaw(x);

        PredictionResult.PredictionResultBuilder res = PredictionResult.builder()
                .modelName(artifact.modelName())
                .algorithmId(artifact.algorithmId())
                .featuresUsed(expected)
                .timestamp(Instant.now(clock));

        if (artifact.targetKind().isRegression()) {
            res.prediction(out[0]);
        } else {
            int k = CrossValidator.argmax(out);
            List<String> labels = artifact.classLabels();
            res.prediction(k)
                    .label(k < labels.size() ? labels.get(k) : String.valueOf(k))
                    .confidence(out[k]);
        }
        return res.build();
    }
}
