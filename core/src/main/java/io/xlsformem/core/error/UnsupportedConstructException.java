package io.xlsformem.core.error;

/**
 * Abstract parent for well-formed input that references a construct with no Expression Manager
 * equivalent. Carries the offending construct name so the fallback can be logged with it.
 */
public abstract class UnsupportedConstructException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final String construct;

    protected UnsupportedConstructException(String message, String construct, String expression) {
        super(message, expression, Phase.TRANSPILE);
        this.construct = construct;
    }

    /** The function name or operator token that could not be converted. */
    public String construct() {
        return construct;
    }
}
