package com.astroiq.service;

import com.astroiq.model.ObjectCandidate;
import com.astroiq.model.PickReport;
import com.astroiq.model.PlateScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PickReportService {
    private static final Logger logger = LoggerFactory.getLogger(PickReportService.class);

    /**
     * @param scale             null si la imagen no tiene escala; el tamaño estelar queda en 0
     * @param pixelCoordsOffset 0 para coordenadas de datos, 1 para convencion FITS
     */
    public PickReport makeReport(ObjectCandidate qs, PlateScale scale, double pixelCoordsOffset) {
        double starsize = 0.0;
        if (scale == null) {
            logger.warn("Couldn't calculate star size: no plate scale");
        } else {
            starsize = PlateScaleService.starsize(qs.fwhmX, qs.fwhmY, scale);
        }
        return new PickReport(qs.objx + pixelCoordsOffset, qs.objy + pixelCoordsOffset,
                qs.fwhm, qs.fwhmX, qs.fwhmY, qs.ellipticity, qs.background, qs.skylevel, qs.brightness, starsize);
    }
}
