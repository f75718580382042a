package com.astroiq.service;

import com.astroiq.exception.FittingException;
import com.astroiq.model.FitMethod;
import com.astroiq.model.FitResult;
import com.astroiq.model.FwhmMeasurement;
import com.astroiq.model.PixelField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FwhmEstimator {
    private static final Logger logger = LoggerFactory.getLogger(FwhmEstimator.class);

    private final CurveFitter fitter;
    private final ProfileExtractor extractor = new ProfileExtractor();

    public FwhmEstimator(CurveFitter fitter) {
        this.fitter = fitter;
    }

    /**
     * FWHM en X e Y ajustando cada corte de la cruz por separado.
     *
     * @param background fondo comun; si es null se usa la mediana del campo
     */
    public FwhmMeasurement estimateFwhm(double x, double y, int radius, PixelField field, Double background, FitMethod method)
            throws FittingException {
        double medv = (background != null) ? background : PixelStatistics.median(field);

        ProfileExtractor.CrossCut cut = extractor.cutCross(field, x, y, radius);
        FitResult xRes = fitter.fitProfile(cut.xProfile, medv, method);
        FitResult yRes = fitter.fitProfile(cut.yProfile, medv, method);

        double ctrX = cut.x0 + xRes.mu;
        double ctrY = cut.y0 + yRes.mu;
        logger.debug("fwhm_x,fwhm_y={},{} center={},{}", xRes.fwhm, yRes.fwhm, ctrX, ctrY);
        return new FwhmMeasurement(xRes.fwhm, yRes.fwhm, ctrX, ctrY, xRes, yRes);
    }
}
