package io.xlsformem.core.error;

/**
 * Thrown for operator tokens with no EM form, notably the XPath path-algebra operators ({@code |
 * / // [] .. @ :: ,}).
 */
public final class UnsupportedOperatorException extends UnsupportedConstructException {

    private static final long serialVersionUID = 1L;

    public UnsupportedOperatorException(String message, String operator, String expression) {
        super(message, operator, expression);
    }
}
