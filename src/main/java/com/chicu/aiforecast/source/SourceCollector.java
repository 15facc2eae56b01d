package com.chicu.aiforecast.source;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.config.SourceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Параллельный сбор со всех включённых коннекторов.
 * Ждёт до дедлайна прогона, не успевшие задачи отменяются (interrupt).
 */
@Slf4j
@Service
public class SourceCollector {

    private final List<SourceConnector> connectors;
    private final SourceProperties sourceProperties;
    private final ExecutorService executor;

    public SourceCollector(List<SourceConnector> connectors,
                           SourceProperties sourceProperties,
                           @Qualifier("collectorExecutor") ExecutorService executor) {
        this.connectors = List.copyOf(connectors);
        this.sourceProperties = sourceProperties;
        this.executor = executor;
        log.info("📡 SourceCollector поднят. Коннекторов: {}", this.connectors.size());
    }

    public CollectionOutcome collectAll(FetchContext ctx) {

        Map<SourceKind, Future<SourceFetchResult>> futures = new EnumMap<>(SourceKind.class);
        for (SourceConnector c : connectors) {
            if (!sourceProperties.forSource(c.kind()).isEnabled()) {
                log.info("⏸ SOURCE {} выключен в конфиге", c.kind().id());
                continue;
            }
            futures.put(c.kind(), executor.submit(() -> c.collect(ctx)));
        }

        List<SourceFetchResult> results = new ArrayList<>();
        List<SourceKind> timedOut = new ArrayList<>();
        Map<SourceKind, String> failures = new EnumMap<>(SourceKind.class);

        for (Map.Entry<SourceKind, Future<SourceFetchResult>> e : futures.entrySet()) {
            SourceKind kind = e.getKey();
            Future<SourceFetchResult> f = e.getValue();
            try {
                results.add(f.get(ctx.deadline().remainingMs(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException | CancellationException ex) {
                f.cancel(true);
                timedOut.add(kind);
                log.warn("⏱ SOURCE {} не уложился в дедлайн прогона → отменён", kind.id());
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                failures.put(kind, String.valueOf(cause.getMessage()));
                log.error("❌ SOURCE {} упал: {}", kind.id(), cause.getMessage(), cause);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.values().forEach(x -> x.cancel(true));
                throw new CancellationException("collection interrupted");
            }
        }

        log.info("📡 COLLECT DONE ok={} timedOut={} failed={}",
                results.size(), timedOut, failures.keySet());

        return CollectionOutcome.builder()
                .results(results)
                .timedOut(timedOut)
                .failures(failures)
                .build();
    }
}
