package com.astroiq.model;

import java.util.Locale;

/**
 * Perfiles 1D que se pueden ajustar a un corte de una estrella.
 */
public enum FitMethod {

    /** Parametros {@code (mean, sdev, amp)}; {@code amp} es el area bajo la curva. */
    GAUSSIAN(3) {
        @Override
        public double value(double x, double... p) {
            double d = x - p[0];
            return (1.0 / (p[1] * Math.sqrt(2 * Math.PI))) * Math.exp(-(d * d) / (2 * p[1] * p[1])) * p[2];
        }

        @Override
        public double fwhm(double... p) {
            return 2.0 * Math.sqrt(2.0 * Math.log(2.0)) * Math.abs(p[1]);
        }
    },

    /** Parametros {@code (mean, width, power, amp)}. */
    MOFFAT(4) {
        @Override
        public double value(double x, double... p) {
            double d = x - p[0];
            return Math.pow(1.0 + (d * d) / (p[1] * p[1]), -p[2]) * p[3];
        }

        @Override
        public double fwhm(double... p) {
            return 2.0 * Math.abs(p[1]) * Math.sqrt(Math.pow(2.0, 1.0 / p[2]) - 1.0);
        }
    };

    private final int parameterCount;

    FitMethod(int parameterCount) {
        this.parameterCount = parameterCount;
    }

    public int parameterCount() { return parameterCount; }

    public abstract double value(double x, double... p);

    public abstract double fwhm(double... p);

    public static FitMethod fromName(String name) {
        if (name == null) throw new IllegalArgumentException("Fit method name is null");
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "gaussian": return GAUSSIAN;
            case "moffat": return MOFFAT;
            default: throw new IllegalArgumentException("Unknown fit method: " + name);
        }
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
