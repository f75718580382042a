package com.astroiq.model;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.awt.Rectangle;
import java.util.Arrays;

/**
 * Campo de pixeles inmutable (fila mayor). NaN / Inf marcan pixeles invalidos o enmascarados.
 */
public class PixelField {

    private final int width;
    private final int height;
    private final double[] data;

    public PixelField(int width, int height, double[] data) {
        this(width, height, data, true);
    }

    // copy=false solo para arrays recien creados aqui dentro
    private PixelField(int width, int height, double[] data, boolean copy) {
        if (width <= 0 || height <= 0) throw new IllegalArgumentException("Field size must be positive: " + width + "x" + height);
        if (data.length != width * height) throw new IllegalArgumentException("Expected " + (width * height) + " samples, got " + data.length);
        this.width = width;
        this.height = height;
        this.data = copy ? data.clone() : data;
    }

    public static PixelField of(double[][] rows) {
        if (rows.length == 0 || rows[0].length == 0) throw new IllegalArgumentException("Empty pixel array");
        int h = rows.length, w = rows[0].length;
        double[] d = new double[w * h];
        for (int y = 0; y < h; y++) {
            if (rows[y].length != w) throw new IllegalArgumentException("Ragged row " + y);
            System.arraycopy(rows[y], 0, d, y * w, w);
        }
        return new PixelField(w, h, d, false);
    }

    public static PixelField filled(int width, int height, double value) {
        double[] d = new double[width * height];
        Arrays.fill(d, value);
        return new PixelField(width, height, d, false);
    }

    public static PixelField fromProcessor(ImageProcessor ip) {
        return fromProcessor(ip, new Rectangle(0, 0, ip.getWidth(), ip.getHeight()));
    }

    /** Lee solo el rectangulo {@code r} del procesador; no copia el resto de la imagen. */
    public static PixelField fromProcessor(ImageProcessor ip, Rectangle r) {
        if (r.x < 0 || r.y < 0 || r.width <= 0 || r.height <= 0
                || r.x + r.width > ip.getWidth() || r.y + r.height > ip.getHeight())
            throw new IllegalArgumentException("Rectangle " + r + " outside " + ip.getWidth() + "x" + ip.getHeight() + " image");
        double[] d = new double[r.width * r.height];
        for (int y = 0; y < r.height; y++)
            for (int x = 0; x < r.width; x++)
                d[y * r.width + x] = ip.getPixelValue(r.x + x, r.y + y);
        return new PixelField(r.width, r.height, d, false);
    }

    /**
     * Copia en precision simple. Los valores finitos fuera del rango de float se saturan a
     * +-Float.MAX_VALUE para que sigan siendo validos; muestras vecinas que solo difieren por
     * debajo de la precision de float quedan iguales (meseta).
     */
    public FloatProcessor toFloatProcessor() {
        FloatProcessor ip = new FloatProcessor(width, height);
        float[] px = (float[]) ip.getPixels();
        for (int i = 0; i < data.length; i++) px[i] = toFloat(data[i]);
        return ip;
    }

    static float toFloat(double v) {
        if (Double.isFinite(v) && Math.abs(v) > Float.MAX_VALUE) return v > 0 ? Float.MAX_VALUE : -Float.MAX_VALUE;
        return (float) v;
    }

    public int width() { return width; }
    public int height() { return height; }
    public int size() { return data.length; }

    public double get(int x, int y) { return data[y * width + x]; }

    public boolean contains(double x, double y) {
        return x >= 0 && y >= 0 && x <= width - 1 && y <= height - 1;
    }

    /** Copia de las muestras en orden fila mayor. */
    public double[] values() { return data.clone(); }

    /** Fila {@code y} entre las columnas {@code x0..x1} (inclusive). */
    public double[] row(int y, int x0, int x1) {
        double[] r = new double[x1 - x0 + 1];
        System.arraycopy(data, y * width + x0, r, 0, r.length);
        return r;
    }

    /** Columna {@code x} entre las filas {@code y0..y1} (inclusive). */
    public double[] column(int x, int y0, int y1) {
        double[] c = new double[y1 - y0 + 1];
        for (int y = y0; y <= y1; y++) c[y - y0] = data[y * width + x];
        return c;
    }

    public PixelField crop(int x0, int y0, int w, int h) {
        if (x0 < 0 || y0 < 0 || w <= 0 || h <= 0 || x0 + w > width || y0 + h > height)
            throw new IllegalArgumentException(String.format("Crop %d,%d %dx%d outside %dx%d field", x0, y0, w, h, width, height));
        double[] d = new double[w * h];
        for (int y = 0; y < h; y++) System.arraycopy(data, (y0 + y) * width + x0, d, y * w, w);
        return new PixelField(w, h, d, false);
    }

    public PixelField minus(double v) {
        double[] d = new double[data.length];
        for (int i = 0; i < d.length; i++) d[i] = data[i] - v;
        return new PixelField(width, height, d, false);
    }

    /** Devuelve una copia con los pixeles enmascarados ({@code mask[i] == true}) marcados como NaN. */
    public PixelField masked(boolean[] mask) {
        if (mask.length != data.length) throw new IllegalArgumentException("Mask size mismatch");
        double[] d = data.clone();
        for (int i = 0; i < d.length; i++) if (mask[i]) d[i] = Double.NaN;
        return new PixelField(width, height, d, false);
    }
}
