package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.common.enums.PipelinePhase;
import com.chicu.aiforecast.common.enums.RunStatus;
import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.exception.PersistenceException;
import com.chicu.aiforecast.common.util.RunDeadline;
import com.chicu.aiforecast.config.PipelineProperties;
import com.chicu.aiforecast.etl.features.FeatureEngineer;
import com.chicu.aiforecast.etl.features.FeatureTable;
import com.chicu.aiforecast.etl.normalize.NormalizedBatch;
import com.chicu.aiforecast.etl.normalize.Normalizer;
import com.chicu.aiforecast.ml.ModelTrainer;
import com.chicu.aiforecast.ml.TrainingOutcome;
import com.chicu.aiforecast.ml.eval.CandidateMetrics;
import com.chicu.aiforecast.ml.registry.ModelArtifact;
import com.chicu.aiforecast.source.CollectionOutcome;
import com.chicu.aiforecast.source.FetchContext;
import com.chicu.aiforecast.source.SourceCollector;
import com.chicu.aiforecast.source.SourceFetchResult;
import com.chicu.aiforecast.storage.DatasetSnapshot;
import com.chicu.aiforecast.storage.DatasetStore;
import com.chicu.aiforecast.storage.StagedSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Прогон пайплайна: IDLE → COLLECTING → TRANSFORMING → PERSISTING → (TRAINING) → IDLE.
 * FAILED — только при ошибке хранилища; предыдущие снапшоты и модели при этом не трогаются.
 * Одновременно выполняется один прогон, конкурирующий запрос получает status=busy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineService {

    private final SourceCollector collector;
    private final Normalizer normalizer;
    private final FeatureEngineer featureEngineer;
    private final DatasetStore datasetStore;
    private final ModelTrainer modelTrainer;
    private final PipelineState state;
    private final PipelineProperties props;
    private final RunReportWriter reportWriter;
    private final Clock clock;

    public EtlRunResult runEtl() {
        if (!state.tryStart()) {
            log.warn("⛔ ETL BUSY: прогон уже выполняется");
            return EtlRunResult.busy(Instant.now(clock));
        }
        try {
            EtlRunResult res = doEtl();
            reportWriter.write("collect", res, null);
            return res;
        } catch (RuntimeException e) {
            state.enter(PipelinePhase.FAILED);
            throw e;
        } finally {
            state.finish();
        }
    }

    public TrainModelsResult trainModels() {
        if (!state.tryStart()) {
            log.warn("⛔ TRAIN BUSY: прогон уже выполняется");
            return TrainModelsResult.busy(Instant.now(clock));
        }
        try {
            TrainModelsResult res = doTrain();
            reportWriter.write("train", null, res);
            return res;
        } catch (RuntimeException e) {
            state.enter(PipelinePhase.FAILED);
            throw e;
        } finally {
            state.finish();
        }
    }

    /**
     * ETL и обучение под одной блокировкой. Если ETL упал — обучение не запускается.
     */
    public FullRunResult runFull() {
        if (!state.tryStart()) {
            Instant now = Instant.now(clock);
            return new FullRunResult(EtlRunResult.busy(now), TrainModelsResult.busy(now));
        }
        try {
            EtlRunResult etl = doEtl();
            TrainModelsResult training = etl.status() == RunStatus.FAILED ? null : doTrain();
            reportWriter.write("full", etl, training);
            return new FullRunResult(etl, training);
        } catch (RuntimeException e) {
            state.enter(PipelinePhase.FAILED);
            throw e;
        } finally {
            state.finish();
        }
    }

    // =====================================================
    // ✅ ETL
    // =====================================================

    private EtlRunResult doEtl() {
        Instant started = Instant.now(clock);
        RunDeadline deadline = RunDeadline.after(Duration.ofMillis(props.getRunTimeoutMs()));

        log.info("🚚 ETL START timeoutMs={}", props.getRunTimeoutMs());

        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, Integer> dropped = new LinkedHashMap<>();
        Set<String> degraded = new LinkedHashSet<>();
        List<String> errors = new ArrayList<>();

        // ====== COLLECTING ======
        state.enter(PipelinePhase.COLLECTING);
        CollectionOutcome outcome = collector.collectAll(new FetchContext(started, deadline));

        for (SourceKind k : outcome.timedOut()) {
            degraded.add(k.id());
            errors.add(k.id() + ": timed out, previous snapshot kept");
        }
        outcome.failures().forEach((k, msg) -> {
            degraded.add(k.id());
            errors.add(k.id() + ": " + msg);
        });

        // ====== TRANSFORMING ======
        state.enter(PipelinePhase.TRANSFORMING);
        List<Prepared> prepared = new ArrayList<>();
        for (SourceFetchResult r : outcome.results()) {
            String id = r.source().id();
            if (r.degraded()) {
                degraded.add(id);
                errors.add(id + ": degraded (" + r.degradedReason() + ")");
            }
            try {
                NormalizedBatch batch = normalizer.normalize(r.source(), r.records());
                dropped.put(id, batch.dropped());
                if (batch.size() == 0) {
                    degraded.add(id);
                    errors.add(id + ": no valid records, previous snapshot kept");
                    continue;
                }
                FeatureTable table = featureEngineer.transform(batch);
                prepared.add(new Prepared(r, table, batch.dropped()));
            } catch (RuntimeException e) {
                log.error("❌ TRANSFORM FAILED source={} : {}", id, e.getMessage(), e);
                degraded.add(id);
                errors.add(id + ": transform failed: " + e.getMessage());
            }
        }

        // ====== PERSISTING ======
        state.enter(PipelinePhase.PERSISTING);
        List<StagedSnapshot> staged = new ArrayList<>();
        List<DatasetSnapshot> committed;
        try {
            for (Prepared p : prepared) {
                staged.add(datasetStore.stage(
                        p.table(),
                        p.fetch().records(),
                        started,
                        p.dropped(),
                        p.fetch().degraded(),
                        p.fetch().degradedReason()));
            }
            committed = datasetStore.commit(staged);
        } catch (PersistenceException e) {
            log.error("❌ ETL FAILED: хранилище недоступно: {}", e.getMessage(), e);
            datasetStore.discard(staged);
            errors.add("persistence: " + e.getMessage());
            state.enter(PipelinePhase.FAILED);

            EtlRunResult failed = EtlRunResult.builder()
                    .status(RunStatus.FAILED)
                    .startedAt(started)
                    .finishedAt(Instant.now(clock))
                    .totalRecords(0)
                    .perSourceRecordCounts(Map.of())
                    .degradedSources(List.copyOf(degraded))
                    .droppedRecords(dropped)
                    .errors(errors)
                    .build();
            state.recordEtl(failed, List.of());
            return failed;
        }

        int total = 0;
        for (DatasetSnapshot s : committed) {
            counts.put(s.source().id(), s.recordCount());
            total += s.recordCount();
        }

        RunStatus status;
        if (committed.isEmpty()) {
            status = RunStatus.FAILED;
        } else if (committed.size() < outcome.results().size() + outcome.timedOut().size() + outcome.failures().size()) {
            status = RunStatus.PARTIAL;
        } else {
            status = RunStatus.SUCCESS;
        }

        EtlRunResult res = EtlRunResult.builder()
                .status(status)
                .startedAt(started)
                .finishedAt(Instant.now(clock))
                .totalRecords(total)
                .perSourceRecordCounts(counts)
                .degradedSources(List.copyOf(degraded))
                .droppedRecords(dropped)
                .errors(errors)
                .build();

        state.recordEtl(res, committed);
        state.enter(PipelinePhase.IDLE);

        log.info("✅ ETL DONE status={} total={} perSource={} degraded={}",
                status.json(), total, counts, degraded);
        return res;
    }

    // =====================================================
    // ✅ TRAINING
    // =====================================================

    private TrainModelsResult doTrain() {
        Instant started = Instant.now(clock);
        state.enter(PipelinePhase.TRAINING);

        TrainingOutcome outcome;
        try {
            outcome = modelTrainer.trainAll();
        } catch (PersistenceException e) {
            log.error("❌ TRAIN FAILED: реестр моделей недоступен: {}", e.getMessage(), e);
            state.enter(PipelinePhase.FAILED);
            TrainModelsResult failed = TrainModelsResult.builder()
                    .status(RunStatus.FAILED)
                    .startedAt(started)
                    .finishedAt(Instant.now(clock))
                    .modelsTrained(List.of())
                    .perModelMetrics(Map.of())
                    .failedModels(Map.of())
                    .errors(List.of("persistence: " + e.getMessage()))
                    .build();
            state.recordTraining(failed);
            return failed;
        }

        List<String> trained = new ArrayList<>();
        Map<String, CandidateMetrics> metrics = new LinkedHashMap<>();
        for (ModelArtifact a : outcome.trained()) {
            trained.add(a.modelName());
            metrics.put(a.modelName(), a.metrics());
        }

        RunStatus status;
        if (trained.isEmpty()) {
            status = RunStatus.FAILED;
        } else if (!outcome.failed().isEmpty()) {
            status = RunStatus.PARTIAL;
        } else {
            status = RunStatus.SUCCESS;
        }

        List<String> errors = new ArrayList<>();
        outcome.failed().forEach((model, reason) -> errors.add(model + ": " + reason));

        TrainModelsResult res = TrainModelsResult.builder()
                .status(status)
                .startedAt(started)
                .finishedAt(Instant.now(clock))
                .modelsTrained(trained)
                .perModelMetrics(metrics)
                .failedModels(new LinkedHashMap<>(outcome.failed()))
                .errors(errors)
                .build();

        state.recordTraining(res);
        state.enter(PipelinePhase.IDLE);

        log.info("✅ TRAIN DONE status={} trained={} failed={}", status.json(), trained, outcome.failed().keySet());
        return res;
    }

    private record Prepared(SourceFetchResult fetch, FeatureTable table, int dropped) {}
}
