package io.xlsformem.core.error;

/**
 * Thrown when the normalized expression is not well-formed XPath (unexpected character,
 * unterminated string, missing parenthesis, trailing tokens).
 */
public final class XPathParseException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public XPathParseException(String message, String expression, int position) {
        super(message + " at position " + position, expression, Phase.PARSE);
        this.position = position;
    }

    /** Zero-based character offset into the normalized expression, or -1 if unknown. */
    public int position() {
        return position;
    }
}
