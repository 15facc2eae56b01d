package com.chicu.aiforecast.etl.features;

import com.chicu.aiforecast.common.enums.SourceKind;
import com.chicu.aiforecast.config.FeatureProperties;
import com.chicu.aiforecast.etl.normalize.MarketQuote;
import com.chicu.aiforecast.etl.normalize.Observation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Технические индикаторы по close: RSI, MACD (линия/сигнал/гистограмма), ширина Боллинджера, momentum.
 */
class MarketFeatures implements FeatureRecipe {

    private final FeatureProperties props;
    private final List<String> columns;

    MarketFeatures(FeatureProperties props) {
        this.props = props;
        this.columns = List.of(
                "high_low_ratio", "close_open_ratio",
                "rsi", "macd", "macd_signal", "macd_hist", "bb_width",
                momentumColumn(),
                "day_of_week", "month"
        );
    }

    @Override
    public SourceKind kind() {
        return SourceKind.MARKET;
    }

    @Override
    public List<String> extraColumns() {
        return columns;
    }

    @Override
    public Map<String, double[]> extras(List<Observation> observations) {
        int n = observations.size();
        double[] close = new double[n];
        double[] hl = new double[n];
        double[] co = new double[n];
        double[] dow = new double[n];
        double[] month = new double[n];

        for (int i = 0; i < n; i++) {
            MarketQuote q = (MarketQuote) observations.get(i);
            close[i] = q.close();
            hl[i] = Indicators.ratio(q.high(), q.low());
            co[i] = Indicators.ratio(q.close(), q.open());
            dow[i] = Indicators.dayOfWeek(q.date());
            month[i] = Indicators.month(q.date());
        }

        double[] fast = Indicators.ema(close, props.getMacdFast());
        double[] slow = Indicators.ema(close, props.getMacdSlow());
        double[] macd = new double[n];
        for (int i = 0; i < n; i++) macd[i] = fast[i] - slow[i];
        double[] signal = Indicators.ema(macd, props.getMacdSignal());
        double[] hist = new double[n];
        for (int i = 0; i < n; i++) hist[i] = macd[i] - signal[i];

        Map<String, double[]> out = new LinkedHashMap<>();
        out.put("high_low_ratio", hl);
        out.put("close_open_ratio", co);
        out.put("rsi", Indicators.rsi(close, props.getRsiPeriod()));
        out.put("macd", macd);
        out.put("macd_signal", signal);
        out.put("macd_hist", hist);
        out.put("bb_width", Indicators.bollingerWidth(close, props.getBollingerWindow()));
        out.put(momentumColumn(), Indicators.momentum(close, props.getMomentumLag()));
        out.put("day_of_week", dow);
        out.put("month", month);
        return out;
    }

    private String momentumColumn() {
        return "momentum_" + Math.max(1, props.getMomentumLag());
    }
}
