package com.astroiq.model;

public class PickReport {
    public final double x;
    public final double y;
    public final double fwhm;
    public final double fwhmX;
    public final double fwhmY;
    public final double ellipticity;
    public final double background;
    public final double skylevel;
    public final double brightness;
    public final double starsize; // arcsec

    public PickReport(double x, double y, double fwhm, double fwhmX, double fwhmY, double ellipticity,
                      double background, double skylevel, double brightness, double starsize) {
        this.x = x;
        this.y = y;
        this.fwhm = fwhm;
        this.fwhmX = fwhmX;
        this.fwhmY = fwhmY;
        this.ellipticity = ellipticity;
        this.background = background;
        this.skylevel = skylevel;
        this.brightness = brightness;
        this.starsize = starsize;
    }

    @Override
    public String toString() {
        return String.format("x=%.3f y=%.3f fwhm=%.3f (%.3f, %.3f) ellip=%.3f bg=%.1f sky=%.1f bright=%.1f size=%.3f\"",
                x, y, fwhm, fwhmX, fwhmY, ellipticity, background, skylevel, brightness, starsize);
    }
}
