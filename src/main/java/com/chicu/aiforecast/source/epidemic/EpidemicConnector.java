package com.chicu.aiforecast.source.epidemic;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.config.SourceProperties;
import com.chicu.aiforecast.source.FetchContext;
import com.chicu.aiforecast.source.HttpSourceConnector;
import com.chicu.aiforecast.source.RawRecord;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.TreeSet;

/**
 * Исторические эпид-счётчики (disease.sh). Ключ не нужен.
 * Ответ: {"cases":{"1/22/20":555,...},"deaths":{...},"recovered":{...}}
 */
@Slf4j
@Component
public class EpidemicConnector extends HttpSourceConnector {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("M/d/yy", Locale.US);

    public EpidemicConnector(OkHttpClient okHttpClient, SourceProperties props) {
        super(okHttpClient, props.getEpidemic());
    }

    @Override
    public SourceKind kind() {
        return SourceKind.EPIDEMIC;
    }

    @Override
    protected boolean requiresApiKey() {
        return false;
    }

    @Override
    protected HttpUrl buildUrl(HttpUrl base) {
        return base.newBuilder()
                .addPathSegments("v3/covid-19/historical/all")
                .addQueryParameter("lastdays", String.valueOf(Math.max(1, settings.getLookbackDays())))
                .build();
    }

    @Override
    protected List<RawRecord> parse(String body, Instant collectedAt) {
        JSONObject root = new JSONObject(body);
        JSONObject cases = root.getJSONObject("cases");
        JSONObject deaths = root.optJSONObject("deaths");
        JSONObject recovered = root.optJSONObject("recovered");

        // ключи JSONObject не упорядочены → собираем и сортируем по дате
        TreeSet<String> days = new TreeSet<>(Comparator.comparing(EpidemicConnector::sortKey));
        days.addAll(cases.keySet());

        List<RawRecord> out = new ArrayList<>(days.size());
        for (String day : days) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("cases", value(cases, day));
            fields.put("deaths", value(deaths, day));
            fields.put("recovered", value(recovered, day));
            out.add(new RawRecord(SourceKind.EPIDEMIC, parseDay(day), fields));
        }
        return out;
    }

    @Override
    public List<RawRecord> synthetic(FetchContext ctx) {
        int n = Math.max(2, settings.getSyntheticRecords());
        Instant anchor = ctx.collectedAt().truncatedTo(ChronoUnit.DAYS);
        Random rnd = new Random(settings.getSyntheticSeed());

        double cases = 1_000_000;
        double deaths = 15_000;
        double recovered = 900_000;

        List<RawRecord> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double daily = 2_000 + 500 * Math.sin(2 * Math.PI * i / 7.0) + rnd.nextGaussian() * 300;
            daily = Math.max(0, daily);

            cases += daily;
            deaths += Math.max(0, daily * 0.015 + rnd.nextGaussian() * 5);
            recovered += Math.max(0, daily * 0.9 + rnd.nextGaussian() * 50);

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("cases", Math.round(cases));
            fields.put("deaths", Math.round(deaths));
            fields.put("recovered", Math.round(recovered));

            Instant day = anchor.minus(n - 1L - i, ChronoUnit.DAYS);
            out.add(new RawRecord(SourceKind.EPIDEMIC, day, fields));
        }
        return out;
    }

    private static Object value(JSONObject series, String day) {
        if (series == null) return null;
        Object v = series.opt(day);
        return v == JSONObject.NULL ? null : v;
    }

    private static Instant parseDay(String day) {
        try {
            return LocalDate.parse(day, DAY).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("epidemic: bad day key '{}'", day);
            return null;
        }
    }

    private static String sortKey(String day) {
        Instant ts = parseDay(day);
        return ts != null ? ts.toString() : "~" + day;
    }
}
