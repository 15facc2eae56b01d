package com.chicu.aiforecast.source.weather;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.config.SourceProperties;
import com.chicu.aiforecast.source.FetchContext;
import com.chicu.aiforecast.source.HttpSourceConnector;
import com.chicu.aiforecast.source.RawRecord;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Прогноз погоды OpenWeatherMap (шаг 3 часа). Нужен API-ключ.
 */
@Component
public class WeatherConnector extends HttpSourceConnector {

    private static final Duration STEP = Duration.ofHours(3);

    public WeatherConnector(OkHttpClient okHttpClient, SourceProperties props) {
        super(okHttpClient, props.getWeather());
    }

    @Override
    public SourceKind kind() {
        return SourceKind.WEATHER;
    }

    @Override
    protected HttpUrl buildUrl(HttpUrl base) {
        return base.newBuilder()
                .addPathSegments("data/2.5/forecast")
                .addQueryParameter("q", settings.getCity())
                .addQueryParameter("appid", settings.getApiKey())
                .addQueryParameter("units", "metric")
                .build();
    }

    @Override
    protected List<RawRecord> parse(String body, Instant collectedAt) {
        JSONObject root = new JSONObject(body);
        JSONArray list = root.getJSONArray("list");

        List<RawRecord> out = new ArrayList<>(list.length());
        for (int i = 0; i < list.length(); i++) {
            JSONObject item = list.getJSONObject(i);
            JSONObject main = item.optJSONObject("main");
            JSONObject wind = item.optJSONObject("wind");
            JSONArray weather = item.optJSONArray("weather");

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("temperature", opt(main, "temp"));
            fields.put("humidity", opt(main, "humidity"));
            fields.put("pressure", opt(main, "pressure"));
            fields.put("wind_speed", opt(wind, "speed"));
            fields.put("description", weather != null && !weather.isEmpty()
                    ? opt(weather.optJSONObject(0), "description")
                    : null);

            Instant ts = item.has("dt") ? Instant.ofEpochSecond(item.getLong("dt")) : null;
            out.add(new RawRecord(SourceKind.WEATHER, ts, fields));
        }
        return out;
    }

    @Override
    public List<RawRecord> synthetic(FetchContext ctx) {
        int n = Math.max(2, settings.getSyntheticRecords());
        Instant anchor = ctx.collectedAt().truncatedTo(ChronoUnit.DAYS);
        Random rnd = new Random(settings.getSyntheticSeed());

        List<RawRecord> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Instant ts = anchor.minus(STEP.multipliedBy(n - 1L - i));
            int hour = ts.atZone(ZoneOffset.UTC).getHour();

            double temp = 14 + 9 * Math.sin(2 * Math.PI * (hour - 9) / 24.0) + rnd.nextGaussian() * 1.5;
            double humidity = Math.max(20, Math.min(100, 65 - 1.2 * (temp - 14) + rnd.nextGaussian() * 5));
            double pressure = 1013 + rnd.nextGaussian() * 4;
            double windSpeed = Math.abs(3 + rnd.nextGaussian() * 1.5);

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("temperature", round2(temp));
            fields.put("humidity", round2(humidity));
            fields.put("pressure", round2(pressure));
            fields.put("wind_speed", round2(windSpeed));
            fields.put("description", describe(temp, humidity));

            out.add(new RawRecord(SourceKind.WEATHER, ts, fields));
        }
        return out;
    }

    private static String describe(double temp, double humidity) {
        if (humidity > 80) return "light rain";
        if (temp > 22) return "clear sky";
        if (temp > 12) return "scattered clouds";
        return "overcast clouds";
    }

    private static Object opt(JSONObject obj, String key) {
        if (obj == null) return null;
        Object v = obj.opt(key);
        return v == JSONObject.NULL ? null : v;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
