package io.xlsformem.core.engine;

import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes a raw XLSForm expression into the XPath the parser accepts. Applied in order:
 *
 * <ol>
 * <li>{@code ${name}} template references become bare sanitized names.
 * <li>{@code selected(field, 'value')} becomes the pre-rendered fragment
 * {@code (field=="value")}, delimited by backticks so the parser emits it verbatim.
 * <li>{@code AND}/{@code OR} in any case become {@code and}/{@code or}.
 * <li>{@code current()} becomes {@code .}.
 * </ol>
 *
 * <p>
 * Steps 3 and 4 leave quoted string literals untouched. Stateless and thread-safe.
 */
public final class ExpressionPreprocessor {

    private static final Pattern FIELD_REFERENCE = Pattern.compile("\\$\\{\\s*(\\w[\\w.\\-]*)\\s*\\}");

    private static final Pattern SELECTED = Pattern.compile(
            "\\bselected\\s*\\(\\s*(?:\\{\\s*([\\w.\\-]+)\\s*\\}|([\\w.\\-]+))\\s*,\\s*"
                    + "(?:'([^'`]*)'|\"([^\"`]*)\")\\s*\\)");

    private static final Pattern BOOLEAN_KEYWORD = Pattern.compile("\\b(?i:and|or)\\b");

    private static final Pattern CURRENT = Pattern.compile("\\bcurrent\\s*\\(\\s*\\)");

    /**
     * Runs all normalization steps.
     *
     * @param source the raw expression (non-null)
     * @return the normalized expression
     */
    public String preprocess(String source) {
        String normalized = replaceFieldReferences(source);
        normalized = rewriteSelected(normalized);
        normalized = lowercaseBooleanKeywords(normalized);
        normalized = replaceOutsideQuotes(normalized, CURRENT, m -> ".");
        return normalized;
    }

    /**
     * Replaces {@code ${name}} with {@code sanitize(name)}. A space is inserted when a name
     * character follows the reference, since {@code -} and {@code .} are name characters in XPath
     * and {@code ${a}-${b}} must not fuse into the single name {@code a-b}.
     */
    public String replaceFieldReferences(String source) {
        Matcher matcher = FIELD_REFERENCE.matcher(source);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = FieldNames.sanitize(matcher.group(1));
            if (matcher.end() < source.length() && isNameChar(source.charAt(matcher.end()))) {
                replacement = replacement + " ";
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /** Lower-cases {@code AND}/{@code OR} outside string literals and backtick fragments. */
    public String lowercaseBooleanKeywords(String source) {
        return replaceOutsideQuotes(source, BOOLEAN_KEYWORD, m -> m.group().toLowerCase(Locale.ROOT));
    }

    String rewriteSelected(String source) {
        Matcher matcher = SELECTED.matcher(source);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String field = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String value = matcher.group(3) != null ? matcher.group(3) : matcher.group(4);
            String fragment = "`(" + FieldNames.sanitize(field) + "==\"" + value.replace("\"", "\\\"") + "\")`";
            matcher.appendReplacement(out, Matcher.quoteReplacement(fragment));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Applies {@code pattern} only to the segments of {@code source} that lie outside string
     * literals and backtick fragments.
     */
    private static String replaceOutsideQuotes(
            String source, Pattern pattern, Function<Matcher, String> replacer) {
        StringBuilder out = new StringBuilder(source.length());
        int segmentStart = 0;
        char quote = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote == 0 && (c == '\'' || c == '"' || c == '`')) {
                out.append(replaceAll(source.substring(segmentStart, i), pattern, replacer));
                quote = c;
                segmentStart = i;
            } else if (quote != 0 && c == quote) {
                out.append(source, segmentStart, i + 1);
                quote = 0;
                segmentStart = i + 1;
            }
        }
        String tail = source.substring(segmentStart);
        out.append(quote == 0 ? replaceAll(tail, pattern, replacer) : tail);
        return out.toString();
    }

    private static String replaceAll(
            String segment, Pattern pattern, Function<Matcher, String> replacer) {
        Matcher matcher = pattern.matcher(segment);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacer.apply(matcher)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
