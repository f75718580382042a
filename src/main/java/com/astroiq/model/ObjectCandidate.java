package com.astroiq.model;

/**
 * Objeto evaluado a partir de un pico. Inmutable: el selector lo conserva o lo descarta.
 * {@code oidX/oidY} valen NaN si el centroide no se pudo calcular.
 */
public class ObjectCandidate {
    public final double x, y;
    public final double objx, objy;
    public final double oidX, oidY;
    public final double fwhm;
    public final double fwhmX, fwhmY;
    public final int fwhmRadius;
    public final double ellipticity;
    public final double background;
    public final double skylevel;
    public final double brightness;
    public final double positionScore;
    public final EnergyProfile ensquaredEnergy;
    public final EnergyProfile encircledEnergy;

    public ObjectCandidate(double x, double y, double objx, double objy, double oidX, double oidY,
                           double fwhm, double fwhmX, double fwhmY, int fwhmRadius, double ellipticity,
                           double background, double skylevel, double brightness, double positionScore,
                           EnergyProfile ensquaredEnergy, EnergyProfile encircledEnergy) {
        this.x = x;
        this.y = y;
        this.objx = objx;
        this.objy = objy;
        this.oidX = oidX;
        this.oidY = oidY;
        this.fwhm = fwhm;
        this.fwhmX = fwhmX;
        this.fwhmY = fwhmY;
        this.fwhmRadius = fwhmRadius;
        this.ellipticity = ellipticity;
        this.background = background;
        this.skylevel = skylevel;
        this.brightness = brightness;
        this.positionScore = positionScore;
        this.ensquaredEnergy = ensquaredEnergy;
        this.encircledEnergy = encircledEnergy;
    }

    public boolean hasCentroid() {
        return !Double.isNaN(oidX) && !Double.isNaN(oidY);
    }

    /** Copia desplazada; se usa para volver a coordenadas de la imagen completa. */
    public ObjectCandidate translate(double dx, double dy) {
        return new ObjectCandidate(x + dx, y + dy, objx + dx, objy + dy, oidX + dx, oidY + dy,
                fwhm, fwhmX, fwhmY, fwhmRadius, ellipticity, background, skylevel, brightness, positionScore,
                ensquaredEnergy, encircledEnergy);
    }

    @Override
    public String toString() {
        return String.format("obj x,y=%.2f,%.2f fwhm=%.2f (%.2f, %.2f) ellip=%.3f bright=%.2f sky=%.2f",
                objx, objy, fwhm, fwhmX, fwhmY, ellipticity, brightness, skylevel);
    }
}
