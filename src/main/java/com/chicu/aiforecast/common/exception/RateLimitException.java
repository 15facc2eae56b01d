package com.chicu.aiforecast.common.exception;

import com.chicu.aiforecast.common.enums.SourceKind;

public class RateLimitException extends SourceConnectionException {

    public RateLimitException(SourceKind source, String message) {
        super(source, "rate limited: " + message);
    }
}
