package com.astroiq.exception;

/** El detector no encontro ningun pico sobre el umbral. */
public class NoPeaksFoundException extends IqCalcException {
    public NoPeaksFoundException(String message) { super(message); }
}
