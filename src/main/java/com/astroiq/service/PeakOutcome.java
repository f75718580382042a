package com.astroiq.service;

import com.astroiq.exception.IqCalcException;
import com.astroiq.model.ObjectCandidate;
import com.astroiq.model.Peak;

/** Resultado de evaluar un pico: un candidato o el error que lo descarto. */
public class PeakOutcome {
    public final Peak peak;
    public final ObjectCandidate candidate;
    public final IqCalcException failure;

    private PeakOutcome(Peak peak, ObjectCandidate candidate, IqCalcException failure) {
        this.peak = peak;
        this.candidate = candidate;
        this.failure = failure;
    }

    static PeakOutcome success(Peak peak, ObjectCandidate candidate) {
        return new PeakOutcome(peak, candidate, null);
    }

    static PeakOutcome failed(Peak peak, IqCalcException failure) {
        return new PeakOutcome(peak, null, failure);
    }

    public boolean isSuccess() { return candidate != null; }
}
