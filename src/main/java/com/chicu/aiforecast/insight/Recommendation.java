package com.chicu.aiforecast.insight;

/**
 * @param type   rerun_collection | degraded_source | insufficient_samples | no_model
 * @param target источник или имя модели
 */
public record Recommendation(
        String type,
        String target,
        String message
) {}
