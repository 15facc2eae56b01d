package com.chicu.aiforecast.source;

import com.chicu.aiforecast.common.exception.RateLimitException;
import com.chicu.aiforecast.common.exception.SourceConnectionException;
import com.chicu.aiforecast.config.SourceProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Общий сценарий сбора: проверка ключа → ретраи с backoff → синтетика (degraded).
 * Наследник реализует только fetch() и synthetic().
 */
@Slf4j
public abstract class AbstractSourceConnector implements SourceConnector {

    protected final SourceProperties.Settings settings;

    protected AbstractSourceConnector(SourceProperties.Settings settings) {
        if (settings == null) throw new IllegalArgumentException("settings=null");
        this.settings = settings;
    }

    /**
     * Нужен ли источнику ключ. Key-less источники переопределяют на false.
     */
    protected boolean requiresApiKey() {
        return true;
    }

    @Override
    public SourceFetchResult collect(FetchContext ctx) {

        if (requiresApiKey() && !settings.hasApiKey()) {
            log.warn("⚠️ SOURCE {} без API-ключа → синтетика (degraded)", kind().id());
            return fallback(ctx, "api key is not configured", 0);
        }

        int max = Math.max(1, settings.getMaxAttempts());
        long backoff = Math.max(0L, settings.getBackoffMs());

        SourceConnectionException last = null;
        int attempt = 0;

        while (attempt < max) {
            attempt++;
            try {
                List<RawRecord> records = fetch(ctx);
                log.info("📥 FETCH OK source={} records={} attempt={}", kind().id(), records.size(), attempt);
                return SourceFetchResult.builder()
                        .source(kind())
                        .records(List.copyOf(records))
                        .degraded(false)
                        .attempts(attempt)
                        .build();
            } catch (SourceConnectionException e) {
                last = e;
                log.warn("📥 FETCH FAIL source={} attempt={}/{} err={}", kind().id(), attempt, max, e.getMessage());

                if (attempt >= max) break;

                long wait = backoff * (1L << Math.min(attempt - 1, 10));
                if (e instanceof RateLimitException) {
                    wait *= 2;
                }
                if (ctx.deadline().remainingMs() <= wait) {
                    log.warn("⏱ SOURCE {} ретраи прерваны: до дедлайна {}ms, пауза {}ms",
                            kind().id(), ctx.deadline().remainingMs(), wait);
                    break;
                }
                sleep(wait);
            }
        }

        String reason = "fetch failed after " + attempt + " attempt(s): "
                + (last != null ? last.getMessage() : "unknown");
        return fallback(ctx, reason, attempt);
    }

    private SourceFetchResult fallback(FetchContext ctx, String reason, int attempts) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("collection of " + kind().id() + " cancelled");
        }

        List<RawRecord> records = synthetic(ctx);
        log.warn("🧪 SYNTHETIC source={} records={} reason={}", kind().id(), records.size(), reason);

        return SourceFetchResult.builder()
                .source(kind())
                .records(List.copyOf(records))
                .degraded(true)
                .degradedReason(reason)
                .attempts(attempts)
                .build();
    }

    private void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("collection of " + kind().id() + " interrupted");
        }
    }
}
