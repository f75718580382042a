package com.astroiq.service;

import com.astroiq.model.IqConfig;
import com.astroiq.model.PlateScale;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PlateScaleService {
    private static final Logger logger = LoggerFactory.getLogger(PlateScaleService.class);

    /**
     * FWHM medio en segundos de arco.
     *
     * @param scaleX grados por pixel en X (CDELT1)
     * @param scaleY grados por pixel en Y (CDELT2)
     */
    public static double starsize(double fwhmX, double scaleX, double fwhmY, double scaleY) {
        double cdelta1 = Math.abs(scaleX);
        double cdelta2 = Math.abs(scaleY);
        double fwhm = (fwhmX * cdelta1 + fwhmY * cdelta2) / 2.0;
        return fwhm * 3600.0;
    }

    public static double starsize(double fwhmX, double fwhmY, PlateScale scale) {
        return starsize(fwhmX, scale.degPerPixelX, fwhmY, scale.degPerPixelY);
    }

    public PlateScale fromHeader(Header header) {
        return fromHeader(header, IqConfig.getPixelScale());
    }

    /**
     * Escala a partir de CDELT1/CDELT2 o, si no estan, de las columnas de la matriz CD.
     * Sin ninguna de las dos se usa {@code defaultArcsecPerPixel}.
     */
    public PlateScale fromHeader(Header header, double defaultArcsecPerPixel) {
        if (header.containsKey("CDELT1") && header.containsKey("CDELT2")) {
            return new PlateScale(header.getDoubleValue("CDELT1", 0), header.getDoubleValue("CDELT2", 0));
        }
        if (header.containsKey("CD1_1") || header.containsKey("CD2_2")) {
            double cd11 = header.getDoubleValue("CD1_1", 0), cd21 = header.getDoubleValue("CD2_1", 0);
            double cd12 = header.getDoubleValue("CD1_2", 0), cd22 = header.getDoubleValue("CD2_2", 0);
            return new PlateScale(Math.hypot(cd11, cd21), Math.hypot(cd12, cd22));
        }
        logger.warn("No CDELT/CD keywords in header, using default scale {}\"/px", defaultArcsecPerPixel);
        return PlateScale.fromArcsecPerPixel(defaultArcsecPerPixel);
    }
}
