package com.astroiq.service;

import com.astroiq.exception.IqCalcException;
import com.astroiq.model.EnergyProfile;
import com.astroiq.model.PixelField;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Brillo por percentil y curvas de energia (ensquared / encircled) sobre una region ya centrada
 * y sin fondo. Los pixeles no finitos cuentan como enmascarados.
 */
public class RegionPhotometry {

    private final ProfileExtractor extractor = new ProfileExtractor();

    /** Percentil 80 de la caja alrededor de (x, y) menos el fondo. */
    public double brightness(PixelField field, double x, double y, int radius, double background) throws IqCalcException {
        double[] v = PixelStatistics.finite(extractor.cutRegion(field, x, y, radius).region.values());
        if (v.length == 0) throw new IqCalcException(String.format("No valid samples around %.2f,%.2f", x, y));
        Arrays.sort(v);
        return v[(int) (v.length * 0.8)] - background;
    }

    public EnergyProfile ensquaredEnergy(PixelField data) throws IqCalcException {
        double tot = total(data);
        int nx = data.width(), ny = data.height();
        int cenX = nx / 2, cenY = ny / 2;
        int nMax, cen;
        if (ny > nx) {
            nMax = ny;
            cen = cenY;
        } else {
            nMax = nx;
            cen = cenX;
        }
        int delta = (nMax % 2 == 0) ? -1 : 0;

        double[] ee = new double[nMax - cen];
        for (int i = 0; i < ee.length; i++) {
            int ix1 = Math.max(0, cenX - i + delta), ix2 = Math.min(nx, cenX + i + 1);
            int iy1 = Math.max(0, cenY - i + delta), iy2 = Math.min(ny, cenY + i + 1);
            double s = 0;
            for (int y = iy1; y < iy2; y++)
                for (int x = ix1; x < ix2; x++) {
                    double v = data.get(x, y);
                    if (Double.isFinite(v)) s += v;
                }
            ee[i] = s / tot;
        }
        return new EnergyProfile(ee);
    }

    public EnergyProfile encircledEnergy(PixelField data) throws IqCalcException {
        double tot = total(data);
        int w = data.width(), n = data.size();
        double cx = (w - 1) * 0.5, cy = (data.height() - 1) * 0.5;
        double[] r = new double[n];
        double[] vals = data.values();
        Integer[] idx = new Integer[n];
        for (int i = 0; i < n; i++) {
            double dx = (i % w) - cx, dy = (i / w) - cy;
            r[i] = Math.sqrt(dx * dx + dy * dy);
            idx[i] = i;
        }
        Arrays.sort(idx, Comparator.comparingDouble(i -> r[i]));

        // suma acumulada por radio creciente; se toma el ultimo pixel de cada radio entero
        double[] ee = new double[n];
        int count = 0;
        double csum = 0;
        for (int k = 0; k < n; k++) {
            double v = vals[idx[k]];
            if (Double.isFinite(v)) csum += v;
            if (k + 1 < n && (int) r[idx[k + 1]] != (int) r[idx[k]]) ee[count++] = csum / tot;
        }
        return new EnergyProfile(Arrays.copyOf(ee, count));
    }

    private static double total(PixelField data) throws IqCalcException {
        double tot = 0;
        for (double v : data.values()) if (Double.isFinite(v)) tot += v;
        if (tot == 0 || !Double.isFinite(tot)) throw new IqCalcException("Total flux is zero or undefined");
        return tot;
    }
}
