package com.chicu.aiforecast.etl.features;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.etl.normalize.Observation;

import java.util.List;
import java.util.Map;

/**
 * Специфичные для источника фичи поверх общих (база, _ma, _growth).
 */
interface FeatureRecipe {

    SourceKind kind();

    /**
     * Имена дополнительных колонок в фиксированном порядке.
     */
    List<String> extraColumns();

    /**
     * Колонка → ряд значений той же длины, что observations. Ключи = extraColumns().
     */
    Map<String, double[]> extras(List<Observation> observations);
}
