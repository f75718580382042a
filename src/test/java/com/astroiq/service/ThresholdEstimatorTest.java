package com.astroiq.service;

import com.astroiq.model.PixelField;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ThresholdEstimatorTest {

    private final ThresholdEstimator estimator = new ThresholdEstimator();

    @Test
    public void testMedianPlusMeanAbsoluteDeviation() {
        PixelField f = new PixelField(5, 1, new double[]{1, 2, 3, 4, 5});
        // mediana 3, desviacion media 1.2
        assertEquals(9.0, estimator.threshold(f), 1e-12);
        assertEquals(5.4, estimator.threshold(f, 2.0), 1e-12);
    }

    @Test
    public void testInvalidPixelsIgnored() {
        PixelField f = new PixelField(3, 2, new double[]{1, Double.NaN, 2, 3, 4, 5});
        assertEquals(9.0, estimator.threshold(f), 1e-12);
    }

    @Test
    public void testFlatField() {
        assertEquals(7.0, estimator.threshold(PixelField.filled(4, 4, 7.0)), 0);
    }

    @Test
    public void testAllInvalid() {
        assertTrue(Double.isNaN(estimator.threshold(PixelField.filled(3, 3, Double.NaN))));
    }
}
