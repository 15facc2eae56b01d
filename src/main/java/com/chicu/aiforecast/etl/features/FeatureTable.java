package com.chicu.aiforecast.etl.features;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.util.List;

/**
 * Processed-данные одного источника: схема + строки по возрастанию времени.
 */
public record FeatureTable(
        SourceKind source,
        FeatureSchema schema,
        List<ProcessedRecord> records
) {
    public FeatureTable {
        if (schema == null) throw new IllegalArgumentException("schema=null");
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public double[] column(String feature) {
        int idx = schema.indexOf(feature);
        if (idx < 0) throw new IllegalArgumentException("нет фичи " + feature + " в " + schema);
        double[] out = new double[records.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = records.get(i).values()[idx];
        }
        return out;
    }
}
