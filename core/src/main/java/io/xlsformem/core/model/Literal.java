package io.xlsformem.core.model;

import java.util.Objects;

/**
 * Literal value. Numbers keep their source digits; string literals keep their original quoted
 * form in {@code display} so the quote character survives conversion.
 *
 * @param value   the unwrapped value (digits for numbers, unquoted text for strings)
 * @param numeric {@code true} for numeric literals
 * @param display the text to emit verbatim, or {@code null} to emit {@code value}
 */
public record Literal(String value, boolean numeric, String display) implements XPathNode {

    public Literal {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static Literal number(String digits) {
        return new Literal(digits, true, null);
    }

    /** A string literal with its original quote character, e.g. {@code 'yes'}. */
    public static Literal quoted(String value, char quote) {
        return new Literal(value, false, quote + value + quote);
    }

    /** A bare string value with no preserved quoting. */
    public static Literal string(String value) {
        return new Literal(value, false, null);
    }

    /** An already-rendered target fragment that must be emitted unchanged. */
    public static Literal verbatim(String fragment) {
        return new Literal(fragment, false, fragment);
    }

    /** Returns the text this literal renders to. */
    public String rendered() {
        return display != null ? display : value;
    }
}
