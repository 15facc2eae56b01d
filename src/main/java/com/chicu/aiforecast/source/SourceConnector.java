package com.chicu.aiforecast.source;

import com.chicu.aiforecast.common.enums.SourceKind;

import java.util.List;

public interface SourceConnector {

    SourceKind kind();

    /**
     * Один вызов к источнику, без ретраев.
     *
     * @throws com.chicu.aiforecast.common.exception.SourceConnectionException сеть/авторизация/payload
     * @throws com.chicu.aiforecast.common.exception.RateLimitException        троттлинг источника
     */
    List<RawRecord> fetch(FetchContext ctx);

    /**
     * Детерминированный синтетический ряд для деградированного режима.
     */
    List<RawRecord> synthetic(FetchContext ctx);

    /**
     * Полный сбор: ретраи с backoff, затем синтетика с degraded=true.
     */
    SourceFetchResult collect(FetchContext ctx);
}
