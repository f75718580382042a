package com.astroiq.service;

import com.astroiq.exception.EvaluationFailedException;
import com.astroiq.exception.IqCalcException;
import com.astroiq.exception.NoCandidateMatchedException;
import com.astroiq.exception.NoPeaksFoundException;
import com.astroiq.model.IqConfig;
import com.astroiq.model.ObjectCandidate;
import com.astroiq.model.Peak;
import com.astroiq.model.PickerSettings;
import com.astroiq.model.PixelField;
import com.astroiq.model.SelectionCriteria;
import ij.process.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Busca el mejor objeto del campo: picos -> evaluacion -> seleccion.
 * No guarda estado entre llamadas salvo el lock del {@link CurveFitter}.
 */
public class FieldPicker {
    private static final Logger logger = LoggerFactory.getLogger(FieldPicker.class);

    private final PickerSettings settings;
    private final PeakDetector detector = new PeakDetector();
    private final PeakEvaluator evaluator;
    private final CandidateSelector selector = new CandidateSelector();

    public FieldPicker() {
        this(PickerSettings.defaults());
    }

    public FieldPicker(PickerSettings settings) {
        this(settings, new CurveFitter());
    }

    public FieldPicker(PickerSettings settings, CurveFitter fitter) {
        this.settings = settings;
        this.evaluator = new PeakEvaluator(fitter, settings);
    }

    /** Picker con los parametros guardados en las preferencias. */
    public static FieldPicker fromConfig() {
        return new FieldPicker(IqConfig.loadSettings());
    }

    public PickerSettings getSettings() { return settings; }

    public ObjectCandidate pick(PixelField field, SelectionCriteria criteria) throws IqCalcException {
        return pick(field, criteria, null, null);
    }

    public ObjectCandidate pick(PixelField field, SelectionCriteria criteria,
                                PeakEvaluationListener listener, AtomicBoolean cancelFlag) throws IqCalcException {
        return pickAll(field, criteria, listener, cancelFlag).get(0);
    }

    /** Todos los candidatos que pasan la seleccion, ordenados; el primero es el que devuelve {@link #pick}. */
    public List<ObjectCandidate> pickAll(PixelField field, SelectionCriteria criteria,
                                         PeakEvaluationListener listener, AtomicBoolean cancelFlag) throws IqCalcException {
        List<Peak> peaks = detector.findPeaks(field, settings.threshold, settings.thresholdSigma, settings.peakRadius);
        logger.debug("peaks={}", peaks);
        if (peaks.isEmpty()) throw new NoPeaksFoundException("Cannot find bright peaks");

        List<ObjectCandidate> objlist = evaluator.evaluate(peaks, field, settings.fwhmRadius, settings.method, listener, cancelFlag);
        if (objlist.isEmpty()) throw new EvaluationFailedException("Error evaluating bright peaks: no candidates found");

        List<ObjectCandidate> results = selector.select(objlist, field.width(), field.height(), criteria);
        if (results.isEmpty()) throw new NoCandidateMatchedException("No object matches selection criteria");
        return results;
    }

    /**
     * Ejecuta {@link #pick} sobre una region de la imagen y devuelve el objeto en coordenadas de la imagen completa.
     *
     * @param region null para usar toda la imagen
     */
    public ObjectCandidate qualsize(ImageProcessor image, Rectangle region, SelectionCriteria criteria) throws IqCalcException {
        Rectangle bounds = new Rectangle(0, 0, image.getWidth(), image.getHeight());
        Rectangle r = (region == null) ? bounds : region.intersection(bounds);
        if (r.isEmpty()) throw new IllegalArgumentException("Region " + region + " does not overlap the image");

        // Solo se copia la region: la imagen completa puede ser muy grande
        PixelField data = PixelField.fromProcessor(image, r);
        ObjectCandidate qs = pick(data, criteria);

        // Volver a sumar el origen de la region
        qs = qs.translate(r.x, r.y);
        logger.debug("obj={},{} fwhm={} sky={} bright={}", qs.objx, qs.objy, qs.fwhm, qs.skylevel, qs.brightness);
        return qs;
    }
}
