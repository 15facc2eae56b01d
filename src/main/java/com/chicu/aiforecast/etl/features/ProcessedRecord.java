package com.chicu.aiforecast.etl.features;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.time.Instant;

/**
 * Строка processed-снапшота: значения в порядке {@link FeatureSchema}.
 */
public record ProcessedRecord(
        SourceKind source,
        Instant timestamp,
        FeatureSchema schema,
        double[] values
) {
    public double value(String feature) {
        int i = schema.indexOf(feature);
        if (i < 0) throw new IllegalArgumentException("нет фичи " + feature + " в " + schema);
        return values[i];
    }
}
