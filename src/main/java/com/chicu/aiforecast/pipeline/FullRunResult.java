package com.chicu.aiforecast.pipeline;

/**
 * runFull: training == null, если ETL упал и обучение не запускалось.
 */
public record FullRunResult(
        EtlRunResult etl,
        TrainModelsResult training
) {}
