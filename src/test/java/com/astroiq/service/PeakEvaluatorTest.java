package com.astroiq.service;

import com.astroiq.exception.FittingException;
import com.astroiq.exception.PickCancelledException;
import com.astroiq.model.FitMethod;
import com.astroiq.model.ObjectCandidate;
import com.astroiq.model.Peak;
import com.astroiq.model.PickerSettings;
import com.astroiq.model.PixelField;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class PeakEvaluatorTest {

    private final PeakEvaluator evaluator = new PeakEvaluator(new CurveFitter(), PickerSettings.defaults());

    /** Estrella en (20,20) sobre fondo 100; fila 0 y columna 0 invalidas. */
    private static PixelField fieldWithDeadBorder() {
        double[] d = MockSkyService.addGaussian(PixelField.filled(40, 40, 100.0), 20.0, 20.0, 2000.0, 2.0, 2.0).values();
        for (int i = 0; i < 40; i++) {
            d[i] = Double.NaN;
            d[i * 40] = Double.NaN;
        }
        return new PixelField(40, 40, d);
    }

    @Test
    public void testFailedPeakIsDropped() throws Exception {
        List<Peak> peaks = Arrays.asList(new Peak(0, 0), new Peak(20, 20));
        List<ObjectCandidate> res = evaluator.evaluate(peaks, fieldWithDeadBorder());
        assertEquals(1, res.size());

        ObjectCandidate obj = res.get(0);
        assertEquals(20.0, obj.x, 0);
        assertEquals(20.0, obj.objx, 1e-3);
        assertEquals(20.0, obj.objy, 1e-3);
        assertEquals(2.0 * 2.0 * Math.sqrt(2.0 * Math.log(2.0)), obj.fwhm, 1e-2);
        assertEquals(1.0, obj.ellipticity, 1e-3);
        assertEquals(1.0, obj.positionScore, 1e-3);
        assertEquals(100.0, obj.background, 1e-6);
        assertEquals(1.05 * obj.background + 40.0, obj.skylevel, 1e-9);
        assertEquals(PickerSettings.DEFAULT_FWHM_RADIUS, obj.fwhmRadius);
        assertTrue(obj.hasCentroid());
        assertEquals(20.0, obj.oidX, 0.05);
        assertNotNull(obj.ensquaredEnergy);
        assertNotNull(obj.encircledEnergy);
        // brillo = altura del ajuste en el centro
        assertEquals(2000.0, obj.brightness, 1.0);
    }

    @Test
    public void testOutcomesAndListener() throws Exception {
        List<Peak> peaks = Arrays.asList(new Peak(0, 0), new Peak(20, 20));
        List<Integer> processed = new ArrayList<>();
        List<PeakOutcome> outcomes = evaluator.evaluateOutcomes(peaks, fieldWithDeadBorder(), 15, FitMethod.GAUSSIAN,
                (outcome, done, total) -> {
                    assertEquals(2, total);
                    processed.add(done);
                }, null);
        assertEquals(Arrays.asList(1, 2), processed);
        assertFalse(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(0).failure instanceof FittingException);
        assertTrue(outcomes.get(1).isSuccess());
    }

    @Test
    public void testEnergyBoxOutsideFieldLeavesProfilesEmpty() throws Exception {
        PixelField f = MockSkyService.addGaussian(PixelField.filled(40, 40, 100.0), 6.0, 20.0, 2000.0, 1.5, 1.5);
        List<ObjectCandidate> res = evaluator.evaluate(Arrays.asList(new Peak(6, 20)), f);
        assertEquals(1, res.size());
        assertNull(res.get(0).ensquaredEnergy);
        assertNull(res.get(0).encircledEnergy);
        assertTrue(res.get(0).positionScore < 1.0);
    }

    @Test(expected = PickCancelledException.class)
    public void testCancelledBeforeStart() throws Exception {
        evaluator.evaluate(Arrays.asList(new Peak(20, 20)), fieldWithDeadBorder(), 15, FitMethod.GAUSSIAN,
                (o, done, total) -> fail("no peak should be processed"), new AtomicBoolean(true));
    }

    @Test
    public void testCancelledFromListener() {
        AtomicBoolean cancel = new AtomicBoolean(false);
        List<Integer> processed = new ArrayList<>();
        try {
            evaluator.evaluate(Arrays.asList(new Peak(20, 20), new Peak(0, 0)), fieldWithDeadBorder(), 15,
                    FitMethod.GAUSSIAN, (o, done, total) -> {
                        processed.add(done);
                        cancel.set(true);
                    }, cancel);
            fail("expected cancellation");
        } catch (PickCancelledException e) {
            assertEquals(Arrays.asList(1), processed);
        }
    }

    @Test
    public void testFittedCenterOutsideFieldIsSkipped() throws Exception {
        // estrella centrada fuera del campo, en x = -1.5: solo se ve su flanco derecho
        PixelField f = MockSkyService.addGaussian(PixelField.filled(40, 40, 100.0), -1.5, 20.0, 3000.0, 3.0, 3.0);
        List<PeakOutcome> outcomes = evaluator.evaluateOutcomes(Arrays.asList(new Peak(0, 20)), f, 15,
                FitMethod.GAUSSIAN, null, null);
        assertEquals(1, outcomes.size());
        assertFalse(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(0).failure instanceof FittingException);
        assertTrue(outcomes.get(0).failure.getMessage().contains("outside field"));
        assertTrue(evaluator.evaluate(Arrays.asList(new Peak(0, 20)), f).isEmpty());
    }
}
