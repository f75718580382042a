package com.astroiq.model;

/**
 * Parametros de deteccion y evaluacion usados por el picker.
 * Las constantes del nivel de cielo vienen del antiguo qualsize() y son empiricas.
 */
public class PickerSettings {
    public static final int DEFAULT_PEAK_RADIUS = 5;
    public static final double DEFAULT_THRESHOLD_SIGMA = 5.0;
    public static final int DEFAULT_FWHM_RADIUS = 15;
    public static final int DEFAULT_EE_TOTAL_RADIUS = 10;
    public static final double DEFAULT_SKYLEVEL_MAGNIFICATION = 1.05;
    public static final double DEFAULT_SKYLEVEL_OFFSET = 40.0;

    public final int peakRadius;
    public final double thresholdSigma;
    public final Double threshold; // null = calcular con thresholdSigma
    public final int fwhmRadius;
    public final FitMethod method;
    public final int eeTotalRadius;
    public final double skylevelMagnification;
    public final double skylevelOffset;

    public PickerSettings(int peakRadius, double thresholdSigma, Double threshold, int fwhmRadius, FitMethod method,
                          int eeTotalRadius, double skylevelMagnification, double skylevelOffset) {
        if (peakRadius < 1) throw new IllegalArgumentException("Peak radius must be >= 1: " + peakRadius);
        if (fwhmRadius < 1) throw new IllegalArgumentException("FWHM radius must be >= 1: " + fwhmRadius);
        if (method == null) throw new IllegalArgumentException("Fit method is required");
        this.peakRadius = peakRadius;
        this.thresholdSigma = thresholdSigma;
        this.threshold = threshold;
        this.fwhmRadius = fwhmRadius;
        this.method = method;
        this.eeTotalRadius = eeTotalRadius;
        this.skylevelMagnification = skylevelMagnification;
        this.skylevelOffset = skylevelOffset;
    }

    public static PickerSettings defaults() {
        return new PickerSettings(DEFAULT_PEAK_RADIUS, DEFAULT_THRESHOLD_SIGMA, null, DEFAULT_FWHM_RADIUS, FitMethod.GAUSSIAN,
                DEFAULT_EE_TOTAL_RADIUS, DEFAULT_SKYLEVEL_MAGNIFICATION, DEFAULT_SKYLEVEL_OFFSET);
    }

    public PickerSettings withMethod(FitMethod m) {
        return new PickerSettings(peakRadius, thresholdSigma, threshold, fwhmRadius, m, eeTotalRadius, skylevelMagnification, skylevelOffset);
    }

    public PickerSettings withThreshold(Double t) {
        return new PickerSettings(peakRadius, thresholdSigma, t, fwhmRadius, method, eeTotalRadius, skylevelMagnification, skylevelOffset);
    }

    public PickerSettings withRadii(int peakRadius, int fwhmRadius) {
        return new PickerSettings(peakRadius, thresholdSigma, threshold, fwhmRadius, method, eeTotalRadius, skylevelMagnification, skylevelOffset);
    }

    public PickerSettings withSkylevel(double magnification, double offset) {
        return new PickerSettings(peakRadius, thresholdSigma, threshold, fwhmRadius, method, eeTotalRadius, magnification, offset);
    }

    public double skylevel(double background) {
        return background * skylevelMagnification + skylevelOffset;
    }
}
