package com.astroiq.model;

import java.util.prefs.Preferences;

/**
 * Parametros persistidos en {@link Preferences}. Las lecturas sin nodo usan el nodo de usuario del paquete;
 * las escrituras reciben siempre el nodo.
 */
public class IqConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(IqConfig.class);

    // Deteccion / ajuste
    static final String KEY_PEAK_RADIUS = "peak_radius";
    static final String KEY_SIGMA = "threshold_sigma";
    static final String KEY_THRESHOLD = "threshold";
    static final String KEY_FWHM_RADIUS = "fwhm_radius";
    static final String KEY_METHOD = "fwhm_method";
    static final String KEY_EE_RADIUS = "ee_total_radius";

    // Nivel de cielo (constantes empiricas heredadas)
    static final String KEY_SKY_MAG = "skylevel_magnification";
    static final String KEY_SKY_OFFSET = "skylevel_offset";

    // Seleccion
    static final String KEY_MIN_FWHM = "min_fwhm";
    static final String KEY_MAX_FWHM = "max_fwhm";
    static final String KEY_MIN_ELLIP = "min_ellipticity";
    static final String KEY_EDGE = "edge_fraction";

    // Escala por defecto cuando la cabecera FITS no trae CDELT/CD
    static final String KEY_SCALE = "pixel_scale";
    public static final double DEFAULT_PIXEL_SCALE = 1.55;

    /** Escala por defecto en segundos de arco por pixel. */
    public static double getPixelScale() { return getPixelScale(prefs); }
    public static double getPixelScale(Preferences p) { return p.getDouble(KEY_SCALE, DEFAULT_PIXEL_SCALE); }
    public static void setPixelScale(Preferences p, double v) { p.putDouble(KEY_SCALE, v); }

    public static PickerSettings loadSettings() { return loadSettings(prefs); }

    public static PickerSettings loadSettings(Preferences p) {
        // Umbral fijo opcional: NaN significa "calcular con sigma"
        double t = p.getDouble(KEY_THRESHOLD, Double.NaN);
        return new PickerSettings(
                p.getInt(KEY_PEAK_RADIUS, PickerSettings.DEFAULT_PEAK_RADIUS),
                p.getDouble(KEY_SIGMA, PickerSettings.DEFAULT_THRESHOLD_SIGMA),
                Double.isNaN(t) ? null : t,
                p.getInt(KEY_FWHM_RADIUS, PickerSettings.DEFAULT_FWHM_RADIUS),
                FitMethod.fromName(p.get(KEY_METHOD, FitMethod.GAUSSIAN.configName())),
                p.getInt(KEY_EE_RADIUS, PickerSettings.DEFAULT_EE_TOTAL_RADIUS),
                p.getDouble(KEY_SKY_MAG, PickerSettings.DEFAULT_SKYLEVEL_MAGNIFICATION),
                p.getDouble(KEY_SKY_OFFSET, PickerSettings.DEFAULT_SKYLEVEL_OFFSET));
    }

    public static void saveSettings(Preferences p, PickerSettings s) {
        p.putInt(KEY_PEAK_RADIUS, s.peakRadius);
        p.putDouble(KEY_SIGMA, s.thresholdSigma);
        if (s.threshold == null) p.remove(KEY_THRESHOLD);
        else p.putDouble(KEY_THRESHOLD, s.threshold);
        p.putInt(KEY_FWHM_RADIUS, s.fwhmRadius);
        p.put(KEY_METHOD, s.method.configName());
        p.putInt(KEY_EE_RADIUS, s.eeTotalRadius);
        p.putDouble(KEY_SKY_MAG, s.skylevelMagnification);
        p.putDouble(KEY_SKY_OFFSET, s.skylevelOffset);
    }

    public static SelectionCriteria loadCriteria() { return loadCriteria(prefs); }

    public static SelectionCriteria loadCriteria(Preferences p) {
        return new SelectionCriteria(
                p.getDouble(KEY_MIN_FWHM, SelectionCriteria.DEFAULT_MIN_FWHM),
                p.getDouble(KEY_MAX_FWHM, SelectionCriteria.DEFAULT_MAX_FWHM),
                p.getDouble(KEY_MIN_ELLIP, SelectionCriteria.DEFAULT_MIN_ELLIPTICITY),
                p.getDouble(KEY_EDGE, SelectionCriteria.DEFAULT_EDGE_FRACTION));
    }

    public static void saveCriteria(Preferences p, SelectionCriteria c) {
        p.putDouble(KEY_MIN_FWHM, c.minFwhm);
        p.putDouble(KEY_MAX_FWHM, c.maxFwhm);
        p.putDouble(KEY_MIN_ELLIP, c.minEllipticity);
        p.putDouble(KEY_EDGE, c.edgeFraction);
    }
}
