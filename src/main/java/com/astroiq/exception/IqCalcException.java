package com.astroiq.exception;

/** Base de los errores del calculo de calidad de imagen. */
public class IqCalcException extends Exception {
    public IqCalcException(String message) { super(message); }
    public IqCalcException(String message, Throwable cause) { super(message, cause); }
}
