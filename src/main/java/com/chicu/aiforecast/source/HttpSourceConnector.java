package com.chicu.aiforecast.source;

import com.chicu.aiforecast.common.exception.RateLimitException;
import com.chicu.aiforecast.common.exception.SourceConnectionException;
import com.chicu.aiforecast.config.HttpClientConfig;
import com.chicu.aiforecast.config.SourceProperties;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.json.JSONException;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * HTTP-источник: GET с per-source таймаутом и маппингом статусов в исключения.
 */
public abstract class HttpSourceConnector extends AbstractSourceConnector {

    private final OkHttpClient http;

    protected HttpSourceConnector(OkHttpClient base, SourceProperties.Settings settings) {
        super(settings);
        this.http = HttpClientConfig.forSource(base, settings);
    }

    protected abstract HttpUrl buildUrl(HttpUrl base);

    /**
     * Разбор тела ответа в RawRecord. JSONException оборачивается в SourceConnectionException.
     */
    protected abstract List<RawRecord> parse(String body, Instant collectedAt);

    @Override
    public List<RawRecord> fetch(FetchContext ctx) {
        HttpUrl base = HttpUrl.parse(settings.getBaseUrl() == null ? "" : settings.getBaseUrl());
        if (base == null) {
            throw new SourceConnectionException(kind(), "bad base url: " + settings.getBaseUrl());
        }

        Request req = new Request.Builder()
                .url(buildUrl(base))
                .header("Accept", "application/json")
                .get()
                .build();

        String body;
        try (Response resp = http.newCall(req).execute()) {
            ResponseBody rb = resp.body();
            body = rb != null ? rb.string() : "";

            if (resp.code() == 429) {
                throw new RateLimitException(kind(), "HTTP 429");
            }
            if (resp.code() == 401 || resp.code() == 403) {
                throw new SourceConnectionException(kind(), "auth failed HTTP " + resp.code());
            }
            if (!resp.isSuccessful()) {
                throw new SourceConnectionException(kind(), "HTTP " + resp.code());
            }
        } catch (IOException e) {
            throw new SourceConnectionException(kind(), "io error: " + e.getMessage(), e);
        }

        try {
            return parse(body, ctx.collectedAt());
        } catch (JSONException e) {
            throw new SourceConnectionException(kind(), "bad payload: " + e.getMessage(), e);
        }
    }
}
