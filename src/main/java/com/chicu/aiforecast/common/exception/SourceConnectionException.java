package com.chicu.aiforecast.common.exception;

import com.chicu.aiforecast.common.enums.SourceKind;
import lombok.Getter;

/**
 * Источник недоступен: сеть, авторизация, не-2xx ответ, битый payload.
 */
@Getter
public class SourceConnectionException extends PipelineException {

    private final SourceKind source;

    public SourceConnectionException(SourceKind source, String message) {
        super(source.id() + ": " + message);
        this.source = source;
    }

    public SourceConnectionException(SourceKind source, String message, Throwable cause) {
        super(source.id() + ": " + message, cause);
        this.source = source;
    }
}
