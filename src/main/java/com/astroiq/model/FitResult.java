package com.astroiq.model;

/**
 * Resultado del ajuste de un corte 1D. {@code mu} esta en coordenadas locales del corte.
 */
public class FitResult {
    public final FitMethod method;
    public final double fwhm;
    public final double mu;
    public final double amplitude;
    private final double[] params;

    public FitResult(FitMethod method, double[] params) {
        this.method = method;
        this.params = params.clone();
        this.fwhm = method.fwhm(params);
        this.mu = params[0];
        this.amplitude = params[params.length - 1];
    }

    /** Desviacion estandar (gaussiana) o ancho del nucleo (Moffat). */
    public double width() { return Math.abs(params[1]); }

    /** Exponente de Moffat; NaN para la gaussiana. */
    public double power() { return method == FitMethod.MOFFAT ? params[2] : Double.NaN; }

    public double value(double x) { return method.value(x, params); }

    /** Evalua la funcion ajustada con la media desplazada a {@code mean} (coordenadas absolutas). */
    public double valueAt(double x, double mean) {
        double[] p = params.clone();
        p[0] = mean;
        return method.value(x, p);
    }

    @Override
    public String toString() {
        return String.format("%s[fwhm=%.3f mu=%.3f width=%.3f amp=%.3f]", method, fwhm, mu, width(), amplitude);
    }
}
