package com.chicu.aiforecast.common.exception;

/**
 * Ошибка записи снапшота/артефакта. Фатальна для прогона.
 */
public class PersistenceException extends PipelineException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
