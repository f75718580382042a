package com.astroiq.service;

import com.astroiq.model.PixelField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ThresholdEstimator {
    private static final Logger logger = LoggerFactory.getLogger(ThresholdEstimator.class);

    public static final double DEFAULT_SIGMA = 5.0;

    public double threshold(PixelField field) { return threshold(field, DEFAULT_SIGMA); }

    /**
     * {@code mediana + sigma * media(|x - mediana|)} sobre las muestras validas (desviacion media absoluta).
     */
    public double threshold(PixelField field, double sigma) {
        double[] f = PixelStatistics.finite(field.values());
        if (f.length == 0) {
            logger.debug("no finite samples, threshold undefined");
            return Double.NaN;
        }
        double median = PixelStatistics.median(f);
        double dist = 0;
        for (double v : f) dist += Math.abs(v - median);
        dist /= f.length;
        double threshold = median + sigma * dist;
        logger.debug("calc threshold={} (median={} mad={} sigma={})", threshold, median, dist, sigma);
        return threshold;
    }
}
