package com.chicu.aiforecast.etl.features;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.etl.normalize.Observation;
import com.chicu.aiforecast.etl.normalize.WeatherObservation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

class WeatherFeatures implements FeatureRecipe {

    private static final List<String> COLUMNS = List.of(
            "temp_fahrenheit", "weather_code", "hour_of_day", "day_of_week", "month"
    );

    /**
     * Фиксированный словарь описаний OpenWeatherMap. Код = индекс; не обучаемый энкодер,
     * поэтому код одного и того же текста не зависит от батча.
     */
    static final List<String> VOCABULARY = List.of(
            "clear sky",
            "few clouds",
            "scattered clouds",
            "broken clouds",
            "overcast clouds",
            "mist",
            "fog",
            "haze",
            "drizzle",
            "light rain",
            "moderate rain",
            "heavy intensity rain",
            "rain",
            "shower rain",
            "thunderstorm",
            "light snow",
            "snow",
            "heavy snow",
            "sleet"
    );

    static final int UNKNOWN_CODE = VOCABULARY.size();

    @Override
    public SourceKind kind() {
        return SourceKind.WEATHER;
    }

    @Override
    public List<String> extraColumns() {
        return COLUMNS;
    }

    @Override
    public Map<String, double[]> extras(List<Observation> observations) {
        int n = observations.size();
        double[] fahrenheit = new double[n];
        double[] code = new double[n];
        double[] hour = new double[n];
        double[] dow = new double[n];
        double[] month = new double[n];

        for (int i = 0; i < n; i++) {
            WeatherObservation o = (WeatherObservation) observations.get(i);
            fahrenheit[i] = o.temperature() * 9.0 / 5.0 + 32.0;
            code[i] = weatherCode(o.description());
            hour[i] = Indicators.hourOfDay(o.at());
            dow[i] = Indicators.dayOfWeek(o.at());
            month[i] = Indicators.month(o.at());
        }

        Map<String, double[]> out = new LinkedHashMap<>();
        out.put("temp_fahrenheit", fahrenheit);
        out.put("weather_code", code);
        out.put("hour_of_day", hour);
        out.put("day_of_week", dow);
        out.put("month", month);
        return out;
    }

    static int weatherCode(String description) {
        if (description == null) return UNKNOWN_CODE;
        int idx = VOCABULARY.indexOf(description.trim().toLowerCase(Locale.ROOT));
        return idx >= 0 ? idx : UNKNOWN_CODE;
    }
}
