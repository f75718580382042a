package com.astroiq.exception;

/** La evaluacion fue interrumpida por el llamador. */
public class PickCancelledException extends IqCalcException {
    public PickCancelledException(String message) { super(message); }
}
