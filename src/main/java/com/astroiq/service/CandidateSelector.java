package com.astroiq.service;

import com.astroiq.model.ObjectCandidate;
import com.astroiq.model.SelectionCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class CandidateSelector {
    private static final Logger logger = LoggerFactory.getLogger(CandidateSelector.class);

    public static double rankScore(ObjectCandidate obj) {
        return obj.brightness * obj.positionScore / Math.sqrt(obj.fwhm);
    }

    /**
     * Filtra por FWHM, elipticidad y distancia al borde, y ordena de mejor a peor.
     * El orden es estable: a igual puntuacion se respeta el orden de deteccion.
     */
    public List<ObjectCandidate> select(List<ObjectCandidate> candidates, int width, int height, SelectionCriteria c) {
        double e = c.edgeFraction;
        List<ObjectCandidate> results = new ArrayList<>();
        int count = 0;
        for (ObjectCandidate obj : candidates) {
            count++;
            logger.debug("{} obj x,y={},{} fwhm={} bright={}", count, obj.objx, obj.objy, obj.fwhm, obj.brightness);
            if (c.minFwhm < obj.fwhm && obj.fwhm < c.maxFwhm
                    && c.minEllipticity < obj.ellipticity
                    && width * e < obj.x && height * e < obj.y
                    && width * (1.0 - e) > obj.x && height * (1.0 - e) > obj.y) {
                results.add(obj);
            }
        }
        results.sort(Comparator.comparingDouble(CandidateSelector::rankScore).reversed());
        return results;
    }
}
