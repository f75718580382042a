package com.astroiq.model;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;

/**
 * Fraccion de energia (ensquared / encircled) por radio entero en pixeles.
 * {@link #value(double)} interpola entre radios y devuelve NaN fuera del rango muestreado.
 */
public class EnergyProfile {
    private final double[] radii;
    private final double[] fractions;
    private final UnivariateFunction interpolant;

    public EnergyProfile(double[] fractions) {
        this.fractions = fractions.clone();
        this.radii = new double[fractions.length];
        for (int i = 0; i < radii.length; i++) radii[i] = i;
        if (fractions.length >= 3) interpolant = new SplineInterpolator().interpolate(radii, this.fractions);
        else if (fractions.length == 2) interpolant = new LinearInterpolator().interpolate(radii, this.fractions);
        else interpolant = null;
    }

    public double[] fractions() { return fractions.clone(); }
    public int size() { return fractions.length; }

    public double value(double r) {
        if (fractions.length == 0 || r < 0 || r > radii[radii.length - 1]) return Double.NaN;
        if (interpolant == null) return fractions[0];
        return interpolant.value(r);
    }
}
