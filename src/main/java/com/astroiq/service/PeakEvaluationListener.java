package com.astroiq.service;

/**
 * Se invoca de forma sincrona desde el hilo que evalua, una vez por pico procesado.
 * Pasar los datos al hilo de la interfaz es cosa del llamador.
 */
@FunctionalInterface
public interface PeakEvaluationListener {
    void peakEvaluated(PeakOutcome outcome, int processed, int total);
}
