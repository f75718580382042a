package com.astroiq.service;

import com.astroiq.model.ObjectCandidate;
import com.astroiq.model.Peak;
import com.astroiq.model.PixelField;
import com.astroiq.model.SelectionCriteria;
import org.junit.Test;

import static org.junit.Assert.*;

public class MockSkyServiceTest {

    @Test
    public void testSameSeedSameField() {
        MockSkyService.StarField a = new MockSkyService(42L).makeStarImage(64, 48, 5, 500, 2000, 2.0, 0.8, 0.8, 1000, 20);
        MockSkyService.StarField b = new MockSkyService(42L).makeStarImage(64, 48, 5, 500, 2000, 2.0, 0.8, 0.8, 1000, 20);
        assertArrayEquals(a.field.values(), b.field.values(), 0);
        assertEquals(5, a.stars.size());
    }

    @Test
    public void testStarsInsideEdge() {
        MockSkyService.StarField sf = new MockSkyService(7L).makeStarImage(100, 100, 20, 500, 2000, 2.0, 1.0, 0.5, 0, 1);
        for (Peak p : sf.stars) {
            assertTrue(p.x >= 25 && p.x <= 75);
            assertTrue(p.y >= 25 && p.y <= 75);
        }
    }

    @Test
    public void testGaussianPeakHeight() {
        PixelField f = MockSkyService.addGaussian(PixelField.filled(11, 11, 10.0), 5, 5, 100.0, 1.0, 2.0);
        assertEquals(110.0, f.get(5, 5), 1e-12);
        assertEquals(10.0 + 100.0 * Math.exp(-0.5), f.get(6, 5), 1e-12);
        assertEquals(10.0 + 100.0 * Math.exp(-0.5), f.get(5, 7), 1e-12);
    }

    @Test
    public void testPickerFindsSyntheticStar() throws Exception {
        MockSkyService.StarField sf = new MockSkyService(1234L).makeStarImage(101, 101, 1, 5000, 5000, 2.0, 1.0, 0.5, 2000, 15);
        ObjectCandidate obj = new FieldPicker().pick(sf.field, SelectionCriteria.defaults());
        Peak star = sf.stars.get(0);
        assertEquals(star.x, obj.objx, 0.5);
        assertEquals(star.y, obj.objy, 0.5);
    }

    @Test
    public void testBlurSpreadsStarKeepingFlux() {
        PixelField empty = PixelField.filled(61, 61, 0.0);
        PixelField sharp = new MockSkyService(3L).addStar(empty, 30, 30, 1000.0, 2.0, 1.0);
        PixelField blurred = new MockSkyService(3L).addStar(empty, 30, 30, 1000.0, 2.0, 1.0, 2.0);

        // sigma^2 = 4 + 4: el pico baja a la mitad
        assertEquals(1000.0, sharp.get(30, 30), 1e-9);
        assertEquals(500.0, blurred.get(30, 30), 15.0);
        assertEquals(sum(sharp), sum(blurred), sum(sharp) * 0.01);
    }

    private static double sum(PixelField f) {
        double s = 0;
        for (double v : f.values()) s += v;
        return s;
    }
}
