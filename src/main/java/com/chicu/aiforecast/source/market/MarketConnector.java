package com.chicu.aiforecast.source.market;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.common.exception.RateLimitException;
import com.chicu.aiforecast.common.exception.SourceConnectionException;
import com.chicu.aiforecast.config.SourceProperties;
import com.chicu.aiforecast.source.FetchContext;
import com.chicu.aiforecast.source.HttpSourceConnector;
import com.chicu.aiforecast.source.RawRecord;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Random;
import java.util.TreeSet;

/**
 * Дневные котировки Alpha Vantage (TIME_SERIES_DAILY). Нужен API-ключ.
 * Значения приходят строками ("1. open": "187.1500") — приведение типов делает нормализатор.
 */
@Component
public class MarketConnector extends HttpSourceConnector {

    private static final String SERIES = "Time Series (Daily)";

    private static final Map<String, String> FIELDS = Map.of(
            "1. open", "open",
            "2. high", "high",
            "3. low", "low",
            "4. close", "close",
            "5. volume", "volume"
    );

    private static final List<String> ORDER = List.of("1. open", "2. high", "3. low", "4. close", "5. volume");

    public MarketConnector(OkHttpClient okHttpClient, SourceProperties props) {
        super(okHttpClient, props.getMarket());
    }

    @Override
    public SourceKind kind() {
        return SourceKind.MARKET;
    }

    @Override
    protected HttpUrl buildUrl(HttpUrl base) {
        return base.newBuilder()
                .addPathSegment("query")
                .addQueryParameter("function", "TIME_SERIES_DAILY")
                .addQueryParameter("symbol", settings.getSymbol())
                .addQueryParameter("outputsize", "compact")
                .addQueryParameter("apikey", settings.getApiKey())
                .build();
    }

    @Override
    protected List<RawRecord> parse(String body, Instant collectedAt) {
        JSONObject root = new JSONObject(body);

        // Alpha Vantage троттлит ответом 200 с текстом в Note/Information
        if (root.has("Note")) {
            throw new RateLimitException(kind(), root.optString("Note"));
        }
        if (root.has("Information")) {
            throw new RateLimitException(kind(), root.optString("Information"));
        }
        if (root.has("Error Message")) {
            throw new SourceConnectionException(kind(), root.optString("Error Message"));
        }

        JSONObject series = root.optJSONObject(SERIES);
        if (series == null) {
            throw new SourceConnectionException(kind(), "payload has no '" + SERIES + "'");
        }

        // ISO-даты сортируются лексикографически
        TreeSet<String> days = new TreeSet<>(series.keySet());

        List<RawRecord> out = new ArrayList<>(days.size());
        for (String day : days) {
            JSONObject v = series.optJSONObject(day);
            Map<String, Object> fields = new LinkedHashMap<>();
            for (String key : ORDER) {
                Object raw = v != null ? v.opt(key) : null;
                fields.put(FIELDS.get(key), raw == JSONObject.NULL ? null : raw);
            }
            out.add(new RawRecord(SourceKind.MARKET, parseDay(day), fields));
        }
        return out;
    }

    @Override
    public List<RawRecord> synthetic(FetchContext ctx) {
        int n = Math.max(2, settings.getSyntheticRecords());
        Instant anchor = ctx.collectedAt().truncatedTo(ChronoUnit.DAYS);
        Random rnd = new Random(settings.getSyntheticSeed());

        double prevClose = 150.0;

        List<RawRecord> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double open = prevClose * (1 + rnd.nextGaussian() * 0.003);
            double close = prevClose * (1 + 0.0005 + rnd.nextGaussian() * 0.015);
            double high = Math.max(open, close) * (1 + Math.abs(rnd.nextGaussian()) * 0.005);
            double low = Math.min(open, close) * (1 - Math.abs(rnd.nextGaussian()) * 0.005);
            long volume = Math.round(Math.abs(50_000_000 + rnd.nextGaussian() * 8_000_000));

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("open", String.format(Locale.ROOT, "%.4f", open));
            fields.put("high", String.format(Locale.ROOT, "%.4f", high));
            fields.put("low", String.format(Locale.ROOT, "%.4f", low));
            fields.put("close", String.format(Locale.ROOT, "%.4f", close));
            fields.put("volume", String.valueOf(volume));

            Instant day = anchor.minus(n - 1L - i, ChronoUnit.DAYS);
            out.add(new RawRecord(SourceKind.MARKET, day, fields));
            prevClose = close;
        }
        return out;
    }

    private static Instant parseDay(String day) {
        try {
            return LocalDate.parse(day).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
