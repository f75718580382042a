package com.astroiq.service;

import com.astroiq.model.PixelField;

public class ProfileExtractor {

    public static class RegionCut {
        public final int x0;
        public final int y0;
        public final PixelField region;

        RegionCut(int x0, int y0, PixelField region) {
            this.x0 = x0;
            this.y0 = y0;
            this.region = region;
        }
    }

    public static class CrossCut {
        public final int x0; // inicio del corte horizontal
        public final int y0; // inicio del corte vertical
        public final double[] xProfile;
        public final double[] yProfile;

        CrossCut(int x0, int y0, double[] xProfile, double[] yProfile) {
            this.x0 = x0;
            this.y0 = y0;
            this.xProfile = xProfile;
            this.yProfile = yProfile;
        }
    }

    /** Caja de lado {@code 2*radius+1} centrada en (x, y) redondeado, recortada a los bordes. */
    public RegionCut cutRegion(PixelField field, double x, double y, int radius) {
        int xi = anchor(x, field.width(), radius), yi = anchor(y, field.height(), radius);
        int x0 = Math.max(0, xi - radius), x1 = Math.min(field.width() - 1, xi + radius);
        int y0 = Math.max(0, yi - radius), y1 = Math.min(field.height() - 1, yi + radius);
        return new RegionCut(x0, y0, field.crop(x0, y0, x1 - x0 + 1, y1 - y0 + 1));
    }

    /** Fila por y y columna por x, cada una recortada de forma independiente. */
    public CrossCut cutCross(PixelField field, double x, double y, int radius) {
        int xi = anchor(x, field.width(), radius), yi = anchor(y, field.height(), radius);
        int x0 = Math.max(0, xi - radius), x1 = Math.min(field.width() - 1, xi + radius);
        int y0 = Math.max(0, yi - radius), y1 = Math.min(field.height() - 1, yi + radius);
        return new CrossCut(x0, y0, field.row(yi, x0, x1), field.column(xi, y0, y1));
    }

    private static int anchor(double v, int size, int radius) {
        if (radius < 0) throw new IllegalArgumentException("Negative radius: " + radius);
        if (!Double.isFinite(v)) throw new IllegalArgumentException("Non-finite anchor: " + v);
        long r = Math.round(v);
        if (r < 0 || r >= size) throw new IllegalArgumentException("Anchor " + v + " outside [0, " + size + ")");
        return (int) r;
    }
}
