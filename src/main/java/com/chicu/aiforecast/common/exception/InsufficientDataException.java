package com.chicu.aiforecast.common.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends PipelineException {

    private final String modelName;
    private final int samples;
    private final int required;

    public InsufficientDataException(String modelName, int samples, int required) {
        super("insufficient data for " + modelName + ": samples=" + samples + " required=" + required);
        this.modelName = modelName;
        this.samples = samples;
        this.required = required;
    }
}
