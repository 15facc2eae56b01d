package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.common.enums.PipelinePhase;
import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.storage.DatasetSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Contract;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Состояние пайплайна на процесс: текущая фаза, последние результаты, ссылки на снапшоты и модели.
 * Один прогон за раз: tryStart() / finish().
 */
@Slf4j
@Component
public class PipelineState {

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<SourceKind, DatasetSnapshot> lastSnapshots = new ConcurrentHashMap<>();

    private volatile PipelinePhase phase = PipelinePhase.IDLE;
    private volatile EtlRunResult lastEtl;
    private volatile TrainModelsResult lastTraining;
    private volatile List<String> lastPublishedModels = List.of();

    @PostConstruct
    public void init() {
        phase = PipelinePhase.IDLE;
        log.info("🟢 PipelineState initialised phase={}", phase);
    }

    @PreDestroy
    public void clear() {
        lastSnapshots.clear();
        lastEtl = null;
        lastTraining = null;
        lastPublishedModels = List.of();
        phase = PipelinePhase.IDLE;
        log.info("💤 PipelineState cleared");
    }

    public boolean tryStart() {
        return running.compareAndSet(false, true);
    }

    public void finish() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public PipelinePhase phase() {
        return phase;
    }

    void enter(PipelinePhase next) {
        log.debug("🔁 PHASE {} → {}", phase, next);
        phase = next;
    }

    void recordEtl(EtlRunResult result, List<DatasetSnapshot> committed) {
        lastEtl = result;
        for (DatasetSnapshot s : committed) {
            lastSnapshots.put(s.source(), s);
        }
    }

    void recordTraining(TrainModelsResult result) {
        lastTraining = result;
        if (!result.modelsTrained().isEmpty()) {
            lastPublishedModels = List.copyOf(result.modelsTrained());
        }
    }

    public EtlRunResult lastEtl() {
        return lastEtl;
    }

    @Contract(pure = true)
    public PipelineStatus status() {
        Map<String, DatasetSnapshot> snaps = new TreeMap<>();
        lastSnapshots.forEach((k, v) -> snaps.put(k.id(), v));
        return PipelineStatus.builder()
                .phase(phase)
                .running(running.get())
                .lastEtl(lastEtl)
                .lastTraining(lastTraining)
                .lastSnapshots(snaps)
                .lastPublishedModels(lastPublishedModels)
                .build();
    }
}
