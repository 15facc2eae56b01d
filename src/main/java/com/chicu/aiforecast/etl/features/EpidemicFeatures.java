package com.chicu.aiforecast.etl.features;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.etl.normalize.EpidemicObservation;
import com.chicu.aiforecast.etl.normalize.Observation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class EpidemicFeatures implements FeatureRecipe {

    private static final List<String> COLUMNS = List.of(
            "new_cases", "new_deaths", "case_fatality_rate", "recovery_rate", "day_of_week", "month"
    );

    @Override
    public SourceKind kind() {
        return SourceKind.EPIDEMIC;
    }

    @Override
    public List<String> extraColumns() {
        return COLUMNS;
    }

    @Override
    public Map<String, double[]> extras(List<Observation> observations) {
        int n = observations.size();
        double[] newCases = new double[n];
        double[] newDeaths = new double[n];
        double[] cfr = new double[n];
        double[] recovery = new double[n];
        double[] dow = new double[n];
        double[] month = new double[n];

        for (int i = 0; i < n; i++) {
            EpidemicObservation o = (EpidemicObservation) observations.get(i);
            if (i > 0) {
                EpidemicObservation p = (EpidemicObservation) observations.get(i - 1);
                // счётчики накопительные; откат ряда считаем нулевым приростом
                newCases[i] = Math.max(0, o.cases() - p.cases());
                newDeaths[i] = Math.max(0, o.deaths() - p.deaths());
            }
            cfr[i] = Indicators.ratio(o.deaths(), o.cases());
            recovery[i] = Indicators.ratio(o.recovered(), o.cases());
            dow[i] = Indicators.dayOfWeek(o.date());
            month[i] = Indicators.month(o.date());
        }

        Map<String, double[]> out = new LinkedHashMap<>();
        out.put("new_cases", newCases);
        out.put("new_deaths", newDeaths);
        out.put("case_fatality_rate", cfr);
        out.put("recovery_rate", recovery);
        out.put("day_of_week", dow);
        out.put("month", month);
        return out;
    }
}
