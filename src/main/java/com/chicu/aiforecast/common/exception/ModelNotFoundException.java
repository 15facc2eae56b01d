package com.chicu.aiforecast.common.exception;

public class ModelNotFoundException extends PipelineException {

    public ModelNotFoundException(String modelName) {
        super("model not found: " + modelName);
    }
}
