package com.astroiq.service;

import com.astroiq.model.Peak;
import com.astroiq.model.PixelField;
import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.plugin.filter.RankFilters;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PeakDetector {
    private static final Logger logger = LoggerFactory.getLogger(PeakDetector.class);

    public static final int DEFAULT_RADIUS = 5;

    private final ThresholdEstimator thresholdEstimator;

    public PeakDetector() {
        this(new ThresholdEstimator());
    }

    public PeakDetector(ThresholdEstimator thresholdEstimator) {
        this.thresholdEstimator = thresholdEstimator;
    }

    public List<Peak> findPeaks(PixelField field) {
        return findPeaks(field, null, ThresholdEstimator.DEFAULT_SIGMA, DEFAULT_RADIUS);
    }

    /**
     * Maximos locales por encima del umbral, un pico por componente conexa (centro de su caja).
     * La posicion es aproximada: el ajuste de FWHM o el centroide la refinan despues.
     *
     * @param threshold umbral fijo; si es null se calcula con {@code sigma}
     * @param radius    tamaño de la ventana del filtro de maximo, en pixeles
     */
    public List<Peak> findPeaks(PixelField field, Double threshold, double sigma, int radius) {
        if (radius < 1) throw new IllegalArgumentException("Radius must be >= 1: " + radius);
        double th;
        if (threshold == null) {
            th = thresholdEstimator.threshold(field, sigma);
            logger.debug("threshold defaults to {} (sigma={})", th, sigma);
        } else {
            th = threshold;
        }
        if (Double.isNaN(th)) return Collections.emptyList();

        int w = field.width(), h = field.height();
        FloatProcessor ip = field.toFloatProcessor();
        float[] px = (float[]) ip.getPixels();
        // Los pixeles invalidos nunca pueden ser maximos
        for (int i = 0; i < px.length; i++) if (!Float.isFinite(px[i])) px[i] = -Float.MAX_VALUE;

        // --- FILTRO DE MAXIMO ---
        FloatProcessor maxIp = (FloatProcessor) ip.duplicate();
        new RankFilters().rank(maxIp, radius / 2.0, RankFilters.MAX);
        float[] mx = (float[]) maxIp.getPixels();

        FloatProcessor maxima = new FloatProcessor(w, h);
        float[] m = (float[]) maxima.getPixels();
        int count = 0;
        for (int i = 0; i < px.length; i++) {
            if (px[i] == mx[i] && px[i] > th) {
                m[i] = 1f;
                count++;
            }
        }
        if (count == 0) {
            logger.debug("no local maxima above threshold {}", th);
            return Collections.emptyList();
        }

        // --- COMPONENTES CONEXAS ---
        maxima.setThreshold(0.5, 1.5, ImageProcessor.NO_LUT_UPDATE);
        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE, Measurements.RECT, rt, 0, Double.POSITIVE_INFINITY);
        pa.analyze(new ImagePlus("maxima", maxima));

        List<Peak> peaks = new ArrayList<>(rt.getCounter());
        for (int i = 0; i < rt.getCounter(); i++) {
            double bx = rt.getValue("BX", i), by = rt.getValue("BY", i);
            double bw = rt.getValue("Width", i), bh = rt.getValue("Height", i);
            peaks.add(new Peak(bx + (bw - 1) / 2.0, by + (bh - 1) / 2.0));
        }
        logger.debug("peaks={}", peaks);
        return peaks;
    }
}
