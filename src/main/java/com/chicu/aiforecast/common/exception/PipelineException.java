package com.chicu.aiforecast.common.exception;

/**
 * Базовое исключение пайплайна. Все наследники unchecked.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
