package com.chicu.aiforecast.etl.features;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Индикаторы по ряду. Все функции возвращают ряд той же длины, значение i
 * считается только по точкам 0..i (без заглядывания вперёд).
 */
public final class Indicators {

    public static final double RSI_NEUTRAL = 50.0;

    private Indicators() {
    }

    /**
     * Среднее последних window точек; в начале ряда окно неполное.
     */
    public static double[] movingAverage(double[] x, int window) {
        int w = Math.max(1, window);
        double[] out = new double[x.length];
        double sum = 0;
        for (int i = 0; i < x.length; i++) {
            sum += x[i];
            if (i >= w) sum -= x[i - w];
            out[i] = sum / Math.min(i + 1, w);
        }
        return out;
    }

    /**
     * (cur - prev) / prev. Первая точка и prev = 0 → 0.
     */
    public static double[] growth(double[] x) {
        double[] out = new double[x.length];
        for (int i = 1; i < x.length; i++) {
            double prev = x[i - 1];
            out[i] = prev == 0 ? 0.0 : (x[i] - prev) / prev;
        }
        return out;
    }

    public static double[] ema(double[] x, int period) {
        double[] out = new double[x.length];
        if (x.length == 0) return out;
        double k = 2.0 / (Math.max(1, period) + 1);
        double v = x[0];
        out[0] = v;
        for (int i = 1; i < x.length; i++) {
            v = x[i] * k + v * (1 - k);
            out[i] = v;
        }
        return out;
    }

    /**
     * RSI по последним period приращениям. Пока истории мало — 50, нет потерь — 100.
     */
    public static double[] rsi(double[] x, int period) {
        int p = Math.max(1, period);
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            if (i < p) {
                out[i] = RSI_NEUTRAL;
                continue;
            }
            double gain = 0, loss = 0;
            for (int j = i - p + 1; j <= i; j++) {
                double d = x[j] - x[j - 1];
                if (d > 0) gain += d;
                else loss -= d;
            }
            out[i] = loss == 0 ? 100.0 : 100 - (100 / (1 + gain / loss));
        }
        return out;
    }

    /**
     * Ширина полос Боллинджера (2σ): (upper - lower) / middle.
     */
    public static double[] bollingerWidth(double[] x, int window) {
        int w = Math.max(1, window);
        double[] ma = movingAverage(x, w);
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            int from = Math.max(0, i - w + 1);
            int n = i - from + 1;
            double var = 0;
            for (int j = from; j <= i; j++) {
                var += (x[j] - ma[i]) * (x[j] - ma[i]);
            }
            double std = Math.sqrt(var / n);
            out[i] = ma[i] == 0 ? 0.0 : (4 * std) / ma[i];
        }
        return out;
    }

    /**
     * x[i] - x[i - lag]; пока истории меньше lag — 0.
     */
    public static double[] momentum(double[] x, int lag) {
        int l = Math.max(1, lag);
        double[] out = new double[x.length];
        for (int i = l; i < x.length; i++) {
            out[i] = x[i] - x[i - l];
        }
        return out;
    }

    public static double ratio(double a, double b) {
        return b == 0 ? 0.0 : a / b;
    }

    // ====== календарь (UTC) ======

    public static double hourOfDay(Instant ts) {
        return utc(ts).getHour();
    }

    public static double dayOfWeek(Instant ts) {
        return utc(ts).getDayOfWeek().getValue();
    }

    public static double month(Instant ts) {
        return utc(ts).getMonthValue();
    }

    private static ZonedDateTime utc(Instant ts) {
        return ts.atZone(ZoneOffset.UTC);
    }
}
