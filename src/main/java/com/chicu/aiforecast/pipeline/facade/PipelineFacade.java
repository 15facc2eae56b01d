package com.chicu.aiforecast.pipeline.facade;

import com.chicu.aiforecast.insight.InsightReport;
import com.chicu.aiforecast.insight.TrendReport;
import com.chicu.aiforecast.ml.registry.PredictionResult;
import com.chicu.aiforecast.pipeline.EtlRunResult;
import com.chicu.aiforecast.pipeline.FullRunResult;
import com.chicu.aiforecast.pipeline.PipelineStatus;
import com.chicu.aiforecast.pipeline.TrainModelsResult;

import java.util.Map;

/**
 * Операции пайплайна для внешнего слоя (HTTP/CLI).
 */
public interface PipelineFacade {

    /**
     * Сбор → нормализация → фичи → снапшоты. Ошибки источников не валят прогон.
     */
    EtlRunResult runEtl();

    /**
     * Обучение и выбор модели по всем целям на последних снапшотах.
     */
    TrainModelsResult trainModels();

    /**
     * @throws com.chicu.aiforecast.common.exception.FeatureMismatchException фичи не совпадают с контрактом модели
     * @throws com.chicu.aiforecast.common.exception.ModelNotFoundException    модели с таким именем нет
     */
    PredictionResult predict(String modelName, Map<String, Double> features);

    InsightReport getInsights();

    TrendReport getTrends(String source, int windowDays);

    FullRunResult runFull();

    /**
     * Текущая фаза и итоги последних прогонов этого процесса.
     */
    PipelineStatus getStatus();
}
