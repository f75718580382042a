package com.astroiq.service;

import com.astroiq.exception.FittingException;
import com.astroiq.exception.IqCalcException;
import com.astroiq.exception.PickCancelledException;
import com.astroiq.model.EnergyProfile;
import com.astroiq.model.FitMethod;
import com.astroiq.model.FwhmMeasurement;
import com.astroiq.model.ObjectCandidate;
import com.astroiq.model.Peak;
import com.astroiq.model.PickerSettings;
import com.astroiq.model.PixelField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

public class PeakEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(PeakEvaluator.class);

    private final FwhmEstimator fwhmEstimator;
    private final CentroidEstimator centroidEstimator = new CentroidEstimator();
    private final RegionPhotometry photometry = new RegionPhotometry();
    private final PickerSettings settings;

    public PeakEvaluator(CurveFitter fitter, PickerSettings settings) {
        this.fwhmEstimator = new FwhmEstimator(fitter);
        this.settings = settings;
    }

    public List<ObjectCandidate> evaluate(List<Peak> peaks, PixelField field) throws PickCancelledException {
        return evaluate(peaks, field, settings.fwhmRadius, settings.method, null, null);
    }

    /**
     * Caracteriza cada pico; los que fallan se descartan sin abortar el lote.
     *
     * @param listener   opcional, una llamada por pico procesado
     * @param cancelFlag opcional, se consulta antes de cada pico
     */
    public List<ObjectCandidate> evaluate(List<Peak> peaks, PixelField field, int fwhmRadius, FitMethod method,
                                          PeakEvaluationListener listener, AtomicBoolean cancelFlag)
            throws PickCancelledException {
        return evaluateOutcomes(peaks, field, fwhmRadius, method, listener, cancelFlag).stream()
                .filter(PeakOutcome::isSuccess)
                .map(o -> o.candidate)
                .collect(Collectors.toList());
    }

    public List<PeakOutcome> evaluateOutcomes(List<Peak> peaks, PixelField field, int fwhmRadius, FitMethod method,
                                              PeakEvaluationListener listener, AtomicBoolean cancelFlag)
            throws PickCancelledException {
        // Mediana (fondo) una sola vez para todo el campo
        double median = PixelStatistics.median(field);
        // El antiguo qualsize() aplicaba este ajuste al nivel de cielo
        double skylevel = settings.skylevel(median);

        List<PeakOutcome> outcomes = new ArrayList<>(peaks.size());
        int processed = 0;
        for (Peak peak : peaks) {
            if (cancelFlag != null && cancelFlag.get()) throw new PickCancelledException("Evaluation interrupted!");
            PeakOutcome outcome = evaluatePeak(peak, field, median, skylevel, fwhmRadius, method);
            outcomes.add(outcome);
            processed++;
            if (listener != null) listener.peakEvaluated(outcome, processed, peaks.size());
        }
        return outcomes;
    }

    PeakOutcome evaluatePeak(Peak peak, PixelField field, double median, double skylevel, int fwhmRadius, FitMethod method) {
        int width = field.width(), height = field.height();

        double oidX = Double.NaN, oidY = Double.NaN;
        try {
            double[] c = centroidEstimator.centroid(field, peak.x, peak.y, fwhmRadius);
            oidX = c[0];
            oidY = c[1];
        } catch (IqCalcException | IllegalArgumentException e) {
            logger.debug("Error doing centroid on object at {}: {}", peak, e.getMessage());
        }

        FwhmMeasurement m;
        double bright;
        try {
            m = fwhmEstimator.estimateFwhm(peak.x, peak.y, fwhmRadius, field, median, method);
            if (!field.contains(m.centerX, m.centerY))
                throw new FittingException(String.format("Fitted center %.2f,%.2f outside field", m.centerX, m.centerY));
            double bx = m.fitX.valueAt(Math.round(m.centerX), m.centerX);
            double by = m.fitY.valueAt(Math.round(m.centerY), m.centerY);
            bright = (bx + by) / 2.0;
        } catch (FittingException e) {
            logger.debug("Error doing FWHM on object at {}: {}", peak, e.getMessage());
            return PeakOutcome.failed(peak, e);
        } catch (IllegalArgumentException e) {
            logger.debug("Error doing FWHM on object at {}: {}", peak, e.getMessage());
            return PeakOutcome.failed(peak, new FittingException(e.getMessage(), e));
        }
        double ctrX = m.centerX, ctrY = m.centerY;
        logger.debug("orig={} ctr={},{} fwhm={},{} bright={}", peak, ctrX, ctrY, m.fwhmX, m.fwhmY, bright);

        // fwhm global como un solo valor
        double fwhm = Math.sqrt(m.fwhmX * m.fwhmX + m.fwhmY * m.fwhmY) / Math.sqrt(2.0);
        double ellipticity = Math.abs(Math.min(m.fwhmX, m.fwhmY) / Math.max(m.fwhmX, m.fwhmY));

        // distancia al centro de la imagen; constantes 4*w y 4*h sin recalibrar
        double wd = width, ht = height;
        double dx = wd / 2.0 - ctrX;
        double dy = ht / 2.0 - ctrY;
        double dx2 = dx * dx / wd / (wd * 4.0);
        double dy2 = dy * dy / ht / (ht * 4.0);
        double pos = (dx2 > dy2) ? 1.0 - dx2 : 1.0 - dy2;

        // EE sobre la imagen sin fondo
        EnergyProfile eeSq = null, eeCirc = null;
        int eeR = settings.eeTotalRadius;
        int iy1 = (int) (ctrY - eeR), iy2 = (int) (ctrY + eeR) + 1;
        int ix1 = (int) (ctrX - eeR), ix2 = (int) (ctrX + eeR) + 1;
        if (iy1 < 0 || iy2 > height || ix1 < 0 || ix2 > width) {
            logger.debug("Error calculating EE on object at {}: box out of range with radius={}", peak, eeR);
        } else {
            PixelField eeData = field.crop(ix1, iy1, ix2 - ix1, iy2 - iy1).minus(median);
            try {
                eeSq = photometry.ensquaredEnergy(eeData);
            } catch (IqCalcException e) {
                logger.debug("Error calculating ensquared energy on object at {}: {}", peak, e.getMessage());
            }
            try {
                eeCirc = photometry.encircledEnergy(eeData);
            } catch (IqCalcException e) {
                logger.debug("Error calculating encircled energy on object at {}: {}", peak, e.getMessage());
            }
        }

        ObjectCandidate obj = new ObjectCandidate(peak.x, peak.y, ctrX, ctrY, oidX, oidY,
                fwhm, m.fwhmX, m.fwhmY, fwhmRadius, ellipticity, median, skylevel, bright, pos, eeSq, eeCirc);
        return PeakOutcome.success(peak, obj);
    }
}
