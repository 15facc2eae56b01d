package com.chicu.aiforecast.etl.normalize;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.util.List;

/**
 * Наблюдения одного источника после нормализации, отсортированы по времени.
 */
public record NormalizedBatch(
        SourceKind kind,
        List<Observation> observations,
        int dropped
) {
    public NormalizedBatch {
        observations = List.copyOf(observations);
    }

    public int size() {
        return observations.size();
    }
}
