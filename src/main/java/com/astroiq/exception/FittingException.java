package com.astroiq.exception;

/** El ajuste de un perfil 1D no convergio o no era posible. */
public class FittingException extends IqCalcException {
    public FittingException(String message) { super(message); }
    public FittingException(String message, Throwable cause) { super(message, cause); }
}
