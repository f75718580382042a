package com.astroiq.model;

import ij.process.FloatProcessor;
import org.junit.Test;

import java.awt.Rectangle;

import static org.junit.Assert.*;

public class PixelFieldTest {

    private static PixelField ramp(int w, int h) {
        double[] d = new double[w * h];
        for (int i = 0; i < d.length; i++) d[i] = i;
        return new PixelField(w, h, d);
    }

    @Test
    public void testRowsAndAccess() {
        PixelField f = PixelField.of(new double[][]{{1, 2, 3}, {4, 5, 6}});
        assertEquals(3, f.width());
        assertEquals(2, f.height());
        assertEquals(6, f.get(2, 1), 0);
        assertArrayEquals(new double[]{4, 5, 6}, f.row(1, 0, 2), 0);
        assertArrayEquals(new double[]{2, 5}, f.column(1, 0, 1), 0);
    }

    @Test
    public void testSourceArrayIsCopied() {
        double[] d = {1, 2, 3, 4};
        PixelField f = new PixelField(2, 2, d);
        d[0] = 99;
        assertEquals(1, f.get(0, 0), 0);
        f.values()[1] = 99;
        assertEquals(2, f.get(1, 0), 0);
    }

    @Test
    public void testCrop() {
        PixelField f = ramp(10, 10);
        PixelField c = f.crop(2, 3, 4, 2);
        assertEquals(4, c.width());
        assertEquals(2, c.height());
        assertEquals(32, c.get(0, 0), 0);
        assertEquals(45, c.get(3, 1), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCropOutside() {
        ramp(10, 10).crop(8, 8, 4, 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSizeMismatch() {
        new PixelField(3, 3, new double[8]);
    }

    @Test
    public void testMasked() {
        PixelField f = ramp(2, 2).masked(new boolean[]{false, true, false, false});
        assertTrue(Double.isNaN(f.get(1, 0)));
        assertEquals(2, f.get(0, 1), 0);
    }

    @Test
    public void testProcessorConversion() {
        PixelField f = ramp(5, 4);
        FloatProcessor ip = f.toFloatProcessor();
        assertEquals(5, ip.getWidth());
        assertEquals(13f, ip.getf(3, 2), 0f);
        PixelField back = PixelField.fromProcessor(ip);
        assertArrayEquals(f.values(), back.values(), 0);
    }

    @Test
    public void testContains() {
        PixelField f = ramp(10, 5);
        assertTrue(f.contains(0, 0));
        assertTrue(f.contains(9, 4));
        assertFalse(f.contains(9.5, 2));
        assertFalse(f.contains(-0.1, 2));
    }

    @Test
    public void testProcessorRegion() {
        FloatProcessor ip = ramp(10, 8).toFloatProcessor();
        PixelField r = PixelField.fromProcessor(ip, new Rectangle(3, 2, 4, 5));
        assertEquals(4, r.width());
        assertEquals(5, r.height());
        assertEquals(23, r.get(0, 0), 0);
        assertEquals(66, r.get(3, 4), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testProcessorRegionOutside() {
        PixelField.fromProcessor(ramp(10, 8).toFloatProcessor(), new Rectangle(8, 0, 4, 4));
    }

    @Test
    public void testFloatConversionSaturates() {
        PixelField f = new PixelField(3, 1, new double[]{1e40, -1e40, Double.NaN});
        FloatProcessor ip = f.toFloatProcessor();
        assertEquals(Float.MAX_VALUE, ip.getf(0, 0), 0f);
        assertEquals(-Float.MAX_VALUE, ip.getf(1, 0), 0f);
        assertTrue(Float.isNaN(ip.getf(2, 0)));
    }
}
