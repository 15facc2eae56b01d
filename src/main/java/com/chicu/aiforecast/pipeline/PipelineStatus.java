package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.common.enums.PipelinePhase;
import com.chicu.aiforecast.storage.DatasetSnapshot;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Снимок PipelineState для внешнего слоя. lastEtl / lastTraining = null, пока прогонов не было.
 */
@Builder
public record PipelineStatus(
        PipelinePhase phase,
        boolean running,
        EtlRunResult lastEtl,
        TrainModelsResult lastTraining,
        Map<String, DatasetSnapshot> lastSnapshots,
        List<String> lastPublishedModels
) {}
