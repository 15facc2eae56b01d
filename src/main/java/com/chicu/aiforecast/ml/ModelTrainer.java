package com.chicu.aiforecast.ml;

import com.chicu.aiforecast.common.enums.TargetKind;
import com.chicu.aiforecast.common.exception.InsufficientDataException;
import com.chicu.aiforecast.common.exception.PersistenceException;
import com.chicu.aiforecast.common.exception.PipelineException;
import com.chicu.aiforecast.config.TrainingProperties;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.ml.candidates.Candidate;
import com.chicu.aiforecast.ml.candidates.CandidateCatalog;
import com.chicu.aiforecast.ml.candidates.FittedModel;
import com.chicu.aiforecast.ml.candidates.TrainingData;
import com.chicu.aiforecast.ml.dataset.TrainingDatasetBuilder;
import com.chicu.aiforecast.ml.eval.CandidateEvaluation;
import com.chicu.aiforecast.ml.eval.CandidateMetrics;
import com.chicu.aiforecast.ml.eval.CrossValidator;
import com.chicu.aiforecast.ml.eval.WinnerSelector;
import com.chicu.aiforecast.ml.registry.ModelArtifact;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.storage.DatasetStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Обучение и выбор модели на цель:
 * снапшот → датасет → k-fold по всем кандидатам (параллельно) → победитель → refit на всех данных → publish.
 */
@Slf4j
@Service
public class ModelTrainer {

    private final DatasetStore datasetStore;
    private final TrainingDatasetBuilder datasetBuilder;
    private final CandidateCatalog catalog;
    private final ModelRegistry registry;
    private final TrainingProperties props;
    private final ExecutorService executor;
    private final Clock clock;

    public ModelTrainer(DatasetStore datasetStore,
                        TrainingDatasetBuilder datasetBuilder,
                        CandidateCatalog catalog,
                        ModelRegistry registry,
                        TrainingProperties props,
                        @Qualifier("trainingExecutor") ExecutorService executor,
                        Clock clock) {
        this.datasetStore = datasetStore;
        this.datasetBuilder = datasetBuilder;
        this.catalog = catalog;
        this.registry = registry;
        this.props = props;
        this.executor = executor;
        this.clock = clock;
    }

    public int minSamples(ModelTarget target) {
        return target.minSamples(props.getMinSamples());
    }

    /**
     * Все цели по очереди. Ошибка одной цели не мешает остальным; PersistenceException — фатальна.
     */
    public TrainingOutcome trainAll() {
        List<ModelArtifact> trained = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();

        for (ModelTarget target : ModelTarget.values()) {
            try {
                trained.add(train(target));
            } catch (InsufficientDataException e) {
                log.warn("⚠️ TRAIN SKIP model={} samples={} required={}",
                        target.modelName(), e.getSamples(), e.getRequired());
                failed.put(target.modelName(), e.getMessage());
            } catch (PersistenceException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("❌ TRAIN FAILED model={} : {}", target.modelName(), e.getMessage(), e);
                failed.put(target.modelName(), String.valueOf(e.getMessage()));
            }
        }
        return new TrainingOutcome(trained, failed);
    }

    public ModelArtifact train(ModelTarget target) {
        int required = minSamples(target);

        FeatureTable table = datasetStore.loadLatest(target.source())
                .orElseThrow(() -> new InsufficientDataException(target.modelName(), 0, required));

        TrainingDatasetBuilder.Dataset dataset = datasetBuilder.build(datasetBuilder.rows(target, table));
        if (dataset.samples() < required) {
            throw new InsufficientDataException(target.modelName(), dataset.samples(), required);
        }
        return selectAndFit(target.modelName(), target.targetKind(), dataset);
    }

    public ModelArtifact selectAndFit(String modelName, TargetKind kind, TrainingDatasetBuilder.Dataset dataset) {
        long started = System.currentTimeMillis();

        TrainingData data = new TrainingData(
                dataset.X(),
                dataset.y(),
                kind.isRegression() ? 0 : dataset.classLabels().size()
        );
        CrossValidator cv = new CrossValidator(props.getFolds(), props.getSeed());

        List<Candidate> candidates = new ArrayList<>();
        for (Candidate c : catalog.forTarget(kind)) {
            if (c.supports(kind)) candidates.add(c);
        }

        log.info("🧠 TRAIN START model={} samples={} features={} candidates={}",
                modelName, dataset.samples(), dataset.features(), candidates.size());

        List<CandidateEvaluation> evaluations = evaluateAll(modelName, candidates, cv, data);

        CandidateEvaluation winner = WinnerSelector.select(evaluations)
                .orElseThrow(() -> new PipelineException("все кандидаты упали для " + modelName));

        Candidate chosen = candidates.stream()
                .filter(c -> c.algorithmId().equals(winner.algorithmId()))
                .findFirst()
                .orElseThrow();

        FittedModel fitted = chosen.fit(data, props.getSeed());

        ModelArtifact artifact = ModelArtifact.builder()
                .modelName(modelName)
                .targetKind(kind)
                .algorithmId(winner.algorithmId())
                .featureNames(dataset.schema().names())
                .schemaHash(dataset.schema().schemaHash())
                .params(fitted)
                .metrics(winner.metrics())
                .candidateScores(evaluations)
                .classLabels(dataset.classLabels())
                .featureImportance(importance(dataset.schema().names(), fitted))
                .sampleCount(dataset.samples())
                .trainedAt(Instant.now(clock))
                .sourceSnapshotAt(dataset.sourceSnapshotAt())
                .build();

        registry.publish(artifact);

        log.info("🧠 TRAIN OK model={} winner={} {}={} tookMs={}",
                modelName, winner.algorithmId(), winner.metrics().primaryMetric(),
                winner.metrics().primary(), System.currentTimeMillis() - started);
        return artifact;
    }

    /**
     * Важность фич победителя по именам схемы; пусто для линейных моделей.
     */
    static Map<String, Double> importance(List<String> names, FittedModel fitted) {
        double[] imp = fitted.featureImportance(names.size());
        if (imp.length != names.size()) return Map.of();
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < imp.length; i++) out.put(names.get(i), imp[i]);
        return out;
    }

    private List<CandidateEvaluation> evaluateAll(String modelName,
                                                  List<Candidate> candidates,
                                                  CrossValidator cv,
                                                  TrainingData data) {
        List<Callable<CandidateEvaluation>> tasks = new ArrayList<>();
        for (Candidate c : candidates) {
            tasks.add(() -> evaluate(modelName, c, cv, data));
        }

        List<CandidateEvaluation> out = new ArrayList<>(tasks.size());
        try {
            List<Future<CandidateEvaluation>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    out.add(CandidateEvaluation.builder()
                            .algorithmId(candidates.get(i).algorithmId())
                            .error(String.valueOf(cause.getMessage()))
                            .build());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("обучение " + modelName + " прервано", e);
        }
        return out;
    }

    private CandidateEvaluation evaluate(String modelName, Candidate c, CrossValidator cv, TrainingData data) {
        try {
            CandidateMetrics m = cv.evaluate(c, data);
            log.info("📊 CANDIDATE model={} algo={} {}={} {}={}",
                    modelName, c.algorithmId(), m.primaryMetric(), m.primary(), m.secondaryMetric(), m.secondary());
            return CandidateEvaluation.builder()
                    .algorithmId(c.algorithmId())
                    .metrics(m)
                    .build();
        } catch (RuntimeException e) {
            log.warn("⚠️ CANDIDATE FAILED model={} algo={} : {}", modelName, c.algorithmId(), e.getMessage());
            return CandidateEvaluation.builder()
                    .algorithmId(c.algorithmId())
                    .error(String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
