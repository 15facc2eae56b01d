package com.chicu.aiforecast.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * Запрос на предсказание не совпадает с контрактом фич модели.
 */
@Getter
public class FeatureMismatchException extends PipelineException {

    private final String modelName;
    private final List<String> missing;
    private final List<String> unexpected;
    private final List<String> invalid;

    public FeatureMismatchException(String modelName,
                                    List<String> missing,
                                    List<String> unexpected,
                                    List<String> invalid) {
        super(buildMessage(modelName, missing, unexpected, invalid));
        this.modelName = modelName;
        this.missing = List.copyOf(missing);
        this.unexpected = List.copyOf(unexpected);
        this.invalid = List.copyOf(invalid);
    }

    private static String buildMessage(String modelName,
                                       List<String> missing,
                                       List<String> unexpected,
                                       List<String> invalid) {
        StringBuilder sb = new StringBuilder("feature mismatch for ").append(modelName);
        if (!missing.isEmpty()) sb.append(": missing=").append(missing);
        if (!unexpected.isEmpty()) sb.append(": unexpected=").append(unexpected);
        if (!invalid.isEmpty()) sb.append(": non-finite=").append(invalid);
        return sb.toString();
    }
}
