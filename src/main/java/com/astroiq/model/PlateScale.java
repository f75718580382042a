package com.astroiq.model;

/** Escala de placa por eje, en grados por pixel. */
public class PlateScale {
    public final double degPerPixelX;
    public final double degPerPixelY;

    public PlateScale(double degPerPixelX, double degPerPixelY) {
        this.degPerPixelX = degPerPixelX;
        this.degPerPixelY = degPerPixelY;
    }

    public static PlateScale fromArcsecPerPixel(double arcsec) {
        return new PlateScale(arcsec / 3600.0, arcsec / 3600.0);
    }
}
