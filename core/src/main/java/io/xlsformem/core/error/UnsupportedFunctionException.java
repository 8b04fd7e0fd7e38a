package io.xlsformem.core.error;

/** Thrown for a function id missing from the function table, or called with the wrong arity. */
public final class UnsupportedFunctionException extends UnsupportedConstructException {

    private static final long serialVersionUID = 1L;

    public UnsupportedFunctionException(String message, String functionName, String expression) {
        super(message, functionName, expression);
    }
}
