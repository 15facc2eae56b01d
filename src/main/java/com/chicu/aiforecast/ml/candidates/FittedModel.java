package com.chicu.aiforecast.ml.candidates;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Обученные параметры. Сериализуются Jackson'ом в params-файл модели.
 * predictRaw: регрессия → [значение], классификация → вероятности классов.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LinearModel.class, name = "linear"),
        @JsonSubTypes.Type(value = TreeEnsembleModel.class, name = "tree_ensemble")
})
public interface FittedModel {

    double[] predictRaw(double[] x);

    /**
     * Доля вклада каждой фичи (сумма = 1). Пустой массив — модель важности не даёт.
     */
    default double[] featureImportance(int features) {
        return new double[0];
    }
}
