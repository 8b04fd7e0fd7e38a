package io.xlsformem.core.error;

/**
 * Thrown when the transpiler receives a node it cannot classify: a null node, an empty path, or
 * a step with neither a name nor a renderable axis. Indicates a parser or transpiler bug rather
 * than bad user input.
 */
public final class MalformedNodeException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public MalformedNodeException(String message, String expression) {
        super(message, expression, Phase.TRANSPILE);
    }

    public MalformedNodeException(String message, Throwable cause, String expression) {
        super(message, cause, expression, Phase.TRANSPILE);
    }
}
