package com.astroiq.service;

import com.astroiq.model.Peak;
import com.astroiq.model.PixelField;
import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * Campos estelares sinteticos: fondo gaussiano y estrellas 2D gaussianas.
 */
public class MockSkyService {

    public static class StarField {
        public final PixelField field;
        public final List<Peak> stars;

        StarField(PixelField field, List<Peak> stars) {
            this.field = field;
            this.stars = stars;
        }
    }

    private static final double BLUR_ACCURACY = 0.002;

    private final RandomGenerator rng;

    public MockSkyService(long seed) {
        this.rng = new Well19937c(seed);
    }

    public PixelField addBackground(PixelField f, double mean, double sdev) {
        NormalDistribution bg = new NormalDistribution(rng, mean, sdev);
        double[] d = f.values();
        for (int i = 0; i < d.length; i++) d[i] += bg.sample();
        return new PixelField(f.width(), f.height(), d);
    }

    /** Estrella con sigmas ligeramente distintos por eje; {@code ellip} en (0, 1], 1 es redonda. */
    public PixelField addStar(PixelField f, double x, double y, double amp, double sdev, double ellip) {
        return addStar(f, x, y, amp, sdev, ellip, null);
    }

    /** @param blur sigma de un suavizado gaussiano aplicado solo a la estrella; null sin suavizado */
    public PixelField addStar(PixelField f, double x, double y, double amp, double sdev, double ellip, Double blur) {
        double sx = sdev + rng.nextDouble() * (1.0 - ellip);
        double sy = sdev + rng.nextDouble() * (1.0 - ellip);
        if (blur == null) return addGaussian(f, x, y, amp, sx, sy);

        FloatProcessor star = addGaussian(PixelField.filled(f.width(), f.height(), 0.0), x, y, amp, sx, sy).toFloatProcessor();
        new GaussianBlur().blurGaussian(star, blur, blur, BLUR_ACCURACY);
        float[] px = (float[]) star.getPixels();
        double[] d = f.values();
        for (int i = 0; i < d.length; i++) d[i] += px[i];
        return new PixelField(f.width(), f.height(), d);
    }

    /** Suma {@code amp * exp(-dx²/2sx² - dy²/2sy²)}; {@code amp} es la altura del pico. */
    public static PixelField addGaussian(PixelField f, double x, double y, double amp, double sx, double sy) {
        int w = f.width();
        double[] d = f.values();
        for (int i = 0; i < d.length; i++) {
            double dx = (i % w) - x, dy = (i / w) - y;
            d[i] += amp * Math.exp(-(dx * dx) / (2 * sx * sx) - (dy * dy) / (2 * sy * sy));
        }
        return new PixelField(w, f.height(), d);
    }

    /**
     * @param edge fraccion (0-1) del semiancho donde pueden caer las estrellas; 1 permite todo el campo
     */
    public StarField makeStarImage(int width, int height, int numStars, double ampLo, double ampHi,
                                   double sdev, double ellip, double edge, double bgMean, double bgSdev) {
        return makeStarImage(width, height, numStars, ampLo, ampHi, sdev, ellip, edge, null, bgMean, bgSdev);
    }

    /** @param blur sigma del suavizado de cada estrella; null sin suavizado */
    public StarField makeStarImage(int width, int height, int numStars, double ampLo, double ampHi,
                                   double sdev, double ellip, double edge, Double blur, double bgMean, double bgSdev) {
        PixelField f = addBackground(PixelField.filled(width, height, 0.0), bgMean, bgSdev);

        int ctrX = width / 2, ctrY = height / 2;
        int xl = ctrX - (int) (ctrX * edge), xh = ctrX + (int) (ctrX * edge);
        int yl = ctrY - (int) (ctrY * edge), yh = ctrY + (int) (ctrY * edge);

        List<Peak> locs = new ArrayList<>(numStars);
        for (int i = 0; i < numStars; i++) {
            double x = (xh - xl) * rng.nextDouble() + xl;
            double y = (yh - yl) * rng.nextDouble() + yl;
            double amp = (ampHi - ampLo) * rng.nextDouble() + ampLo;
            locs.add(new Peak(x, y));
            f = addStar(f, x, y, amp, sdev, ellip, blur);
        }
        return new StarField(f, locs);
    }
}
