package com.chicu.aiforecast.etl.normalize;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.time.Instant;

/**
 * Нормализованное наблюдение. Одна форма записи на тип источника,
 * к общему числовому вектору приводятся только в FeatureEngineer.
 */
public interface Observation {

    SourceKind kind();

    Instant timestamp();

    /**
     * Числовые колонки в порядке {@link SourceSchema#numericColumns()}.
     */
    double[] values();
}
