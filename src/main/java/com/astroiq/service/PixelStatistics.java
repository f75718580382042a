package com.astroiq.service;

import com.astroiq.model.PixelField;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Media y mediana sobre los valores finitos. Sin valores finitos devuelven NaN (no es un error).
 */
public final class PixelStatistics {

    private PixelStatistics() {}

    public static double[] finite(double[] values) {
        int n = 0;
        for (double v : values) if (Double.isFinite(v)) n++;
        if (n == values.length) return values.clone();
        double[] f = new double[n];
        int i = 0;
        for (double v : values) if (Double.isFinite(v)) f[i++] = v;
        return f;
    }

    public static double mean(double[] values) {
        double[] f = finite(values);
        return f.length == 0 ? Double.NaN : StatUtils.mean(f);
    }

    public static double median(double[] values) {
        double[] f = finite(values);
        return f.length == 0 ? Double.NaN : new Median().evaluate(f);
    }

    public static double mean(PixelField field) { return mean(field.values()); }

    public static double median(PixelField field) { return median(field.values()); }
}
