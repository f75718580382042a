package com.astroiq.exception;

/** Ningun candidato cumple los criterios de seleccion. */
public class NoCandidateMatchedException extends IqCalcException {
    public NoCandidateMatchedException(String message) { super(message); }
}
