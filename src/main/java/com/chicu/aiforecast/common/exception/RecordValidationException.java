package com.chicu.aiforecast.common.exception;

/**
 * Битая запись. Запись отбрасывается и считается, прогон не падает.
 */
public class RecordValidationException extends PipelineException {

    public RecordValidationException(String message) {
        super(message);
    }
}
