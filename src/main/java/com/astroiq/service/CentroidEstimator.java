package com.astroiq.service;

import com.astroiq.exception.IqCalcException;
import com.astroiq.model.PixelField;

public class CentroidEstimator {

    private final ProfileExtractor extractor = new ProfileExtractor();

    /** Centro de masa (ponderado por intensidad) de la caja alrededor de (x, y); devuelve {cx, cy} absolutos. */
    public double[] centroid(PixelField field, double x, double y, int radius) throws IqCalcException {
        ProfileExtractor.RegionCut cut = extractor.cutRegion(field, x, y, radius);
        PixelField r = cut.region;
        double sum = 0, sx = 0, sy = 0;
        for (int j = 0; j < r.height(); j++) {
            for (int i = 0; i < r.width(); i++) {
                double v = r.get(i, j);
                if (!Double.isFinite(v)) continue;
                sum += v;
                sx += v * i;
                sy += v * j;
            }
        }
        if (!(sum > 0)) throw new IqCalcException(String.format("No mass for centroid at %.2f,%.2f", x, y));
        return new double[]{cut.x0 + sx / sum, cut.y0 + sy / sum};
    }
}
