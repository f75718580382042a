package com.astroiq.model;

public class SelectionCriteria {
    public static final double DEFAULT_MIN_FWHM = 2.0;
    public static final double DEFAULT_MAX_FWHM = 50.0;
    public static final double DEFAULT_MIN_ELLIPTICITY = 0.5;
    public static final double DEFAULT_EDGE_FRACTION = 0.01;

    public final double minFwhm;
    public final double maxFwhm;
    public final double minEllipticity;
    public final double edgeFraction;

    public SelectionCriteria(double minFwhm, double maxFwhm, double minEllipticity, double edgeFraction) {
        if (edgeFraction < 0 || edgeFraction >= 0.5) throw new IllegalArgumentException("Edge fraction must be in [0, 0.5): " + edgeFraction);
        this.minFwhm = minFwhm;
        this.maxFwhm = maxFwhm;
        this.minEllipticity = minEllipticity;
        this.edgeFraction = edgeFraction;
    }

    public static SelectionCriteria defaults() {
        return new SelectionCriteria(DEFAULT_MIN_FWHM, DEFAULT_MAX_FWHM, DEFAULT_MIN_ELLIPTICITY, DEFAULT_EDGE_FRACTION);
    }

    @Override
    public String toString() {
        return String.format("fwhm=(%.2f, %.2f) ellip>%.2f edge=%.3f", minFwhm, maxFwhm, minEllipticity, edgeFraction);
    }
}
