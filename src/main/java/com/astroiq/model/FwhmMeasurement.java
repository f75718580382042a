package com.astroiq.model;

public class FwhmMeasurement {
    public final double fwhmX;
    public final double fwhmY;
    public final double centerX;
    public final double centerY;
    public final FitResult fitX;
    public final FitResult fitY;

    public FwhmMeasurement(double fwhmX, double fwhmY, double centerX, double centerY, FitResult fitX, FitResult fitY) {
        this.fwhmX = fwhmX;
        this.fwhmY = fwhmY;
        this.centerX = centerX;
        this.centerY = centerY;
        this.fitX = fitX;
        this.fitY = fitY;
    }
}
