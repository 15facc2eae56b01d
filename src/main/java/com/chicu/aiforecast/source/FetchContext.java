package com.chicu.aiforecast.source;

import com.chicu.aiforecast.common.util.RunDeadline;

import java.time.Instant;

public record FetchContext(
        Instant collectedAt,
        RunDeadline deadline
) {}
