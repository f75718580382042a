package com.astroiq.exception;

/** Todos los picos fallaron en la evaluacion. */
public class EvaluationFailedException extends IqCalcException {
    public EvaluationFailedException(String message) { super(message); }
}
