package com.chicu.aiforecast.pipeline.facade.impl;

import com.chicu.aiforecast.insight.InsightReport;
import com.chicu.aiforecast.insight.InsightReporter;
import com.chicu.aiforecast.insight.TrendReport;
import com.chicu.aiforecast.ml.registry.PredictionResult;
import com.chicu.aiforecast.ml.registry.PredictionService;
import com.chicu.aiforecast.pipeline.EtlRunResult;
import com.chicu.aiforecast.pipeline.FullRunResult;
import com.chicu.aiforecast.pipeline.PipelineService;
import com.chicu.aiforecast.pipeline.PipelineState;
import com.chicu.aiforecast.pipeline.PipelineStatus;
import com.chicu.aiforecast.pipeline.TrainModelsResult;
import com.chicu.aiforecast.pipeline.facade.PipelineFacade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Тонкий слой: прогоны — в PipelineService, чтение — в PredictionService / InsightReporter.
 */
@Service
@RequiredArgsConstructor
public class PipelineFacadeImpl implements PipelineFacade {

    private final PipelineService pipelineService;
    private final PipelineState pipelineState;
    private final PredictionService predictionService;
    private final InsightReporter insightReporter;

    @Override
    public EtlRunResult runEtl() {
        return pipelineService.runEtl();
    }

    @Override
    public TrainModelsResult trainModels() {
        return pipelineService.trainModels();
    }

    @Override
    public PredictionResult predict(String modelName, Map<String, Double> features) {
        return predictionService.predict(modelName, features);
    }

    @Override
    public InsightReport getInsights() {
        return insightReporter.getInsights();
    }

    @Override
    public TrendReport getTrends(String source, int windowDays) {
        return insightReporter.getTrends(source, windowDays);
    }

    @Override
    public FullRunResult runFull() {
        return pipelineService.runFull();
    }

    @Override
    public PipelineStatus getStatus() {
        return pipelineState.status();
    }
}
