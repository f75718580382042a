package com.astroiq.model;

/** Posicion aproximada de un pico detectado (centro de la caja envolvente). */
public class Peak {
    public final double x;
    public final double y;

    public Peak(double x, double y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public String toString() { return String.format("(%.1f, %.1f)", x, y); }
}
