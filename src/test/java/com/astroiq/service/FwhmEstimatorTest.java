package com.astroiq.service;

import com.astroiq.exception.FittingException;
import com.astroiq.model.FitMethod;
import com.astroiq.model.FwhmMeasurement;
import com.astroiq.model.PixelField;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class FwhmEstimatorTest {

    private final FwhmEstimator estimator = new FwhmEstimator(new CurveFitter());

    @Test
    public void testEllipticalStar() throws Exception {
        PixelField f = MockSkyService.addGaussian(PixelField.filled(61, 61, 100.0), 30.4, 29.8, 3000.0, 2.0, 3.0);
        FwhmMeasurement m = estimator.estimateFwhm(30, 30, 15, f, 100.0, FitMethod.GAUSSIAN);
        double k = 2.0 * Math.sqrt(2.0 * Math.log(2.0));
        assertEquals(2.0 * k, m.fwhmX, 1e-3);
        assertEquals(3.0 * k, m.fwhmY, 1e-3);
        assertEquals(30.4, m.centerX, 1e-3);
        assertEquals(29.8, m.centerY, 1e-3);
    }

    @Test
    public void testBackgroundDefaultsToFieldMedian() throws Exception {
        PixelField f = MockSkyService.addGaussian(PixelField.filled(61, 61, 100.0), 30.0, 30.0, 3000.0, 2.0, 2.0);
        FwhmMeasurement m = estimator.estimateFwhm(30, 30, 15, f, null, FitMethod.GAUSSIAN);
        assertEquals(2.0 * 2.0 * Math.sqrt(2.0 * Math.log(2.0)), m.fwhmX, 1e-2);
        assertEquals(30.0, m.centerY, 1e-3);
    }

    @Test(expected = FittingException.class)
    public void testFlatRegion() throws Exception {
        estimator.estimateFwhm(10, 10, 5, PixelField.filled(21, 21, 10.0), null, FitMethod.MOFFAT);
    }
}
