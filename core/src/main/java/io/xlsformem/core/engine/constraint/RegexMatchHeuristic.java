package io.xlsformem.core.engine.constraint;

import io.xlsformem.core.engine.ExpressionPreprocessor;
import io.xlsformem.core.engine.FieldNames;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles constraints written as a single {@code regexMatch(arg1, arg2)} call. Form authors use
 * this call for two different things:
 *
 * <ul>
 * <li>A real pattern test: {@code regexMatch("^[A-Z]+$", name)} is re-emitted as
 * {@code regexMatch('^[A-Z]+$', name)}, with {@code .} as the subject rewritten to {@code self}.
 * <li>A boolean condition smuggled into the first argument:
 * {@code regexMatch("self >= 18 and self <= 120", age)} returns the condition itself, with
 * {@code AND}/{@code OR} lower-cased as in any other expression.
 * </ul>
 *
 * <p>
 * Any other argument arrangement is reported as unsupported. Arguments are split by hand
 * because the surrounding text is frequently not valid XPath. A {@code regexMatch} call that is
 * only part of a larger constraint is left to the AST path, which renders it like any other
 * function.
 */
public final class RegexMatchHeuristic implements ConstraintHeuristic {

    private static final Pattern CALL_PREFIX = Pattern.compile("^regexMatch\\s*\\(");

    private static final Pattern CHARACTER_CLASS = Pattern.compile("\\[[^\\]]*\\]");

    private static final Pattern GROUP_PREFIX = Pattern.compile("\\(\\?(?:<?[=!]|<\\w+>|:)");

    private static final Pattern COMPARISON = Pattern.compile("<=|>=|!=|==|<|>|=");

    private static final Pattern BOOLEAN_KEYWORD = Pattern.compile("\\b(?i:and|or)\\b");

    private static final Pattern FIELD = Pattern.compile("\\.|[A-Za-z_][\\w.\\-]*");

    private final ExpressionPreprocessor preprocessor = new ExpressionPreprocessor();

    @Override
    public String name() {
        return "regexmatch";
    }

    @Override
    public Optional<ConstraintMatch> apply(String source) {
        Matcher prefix = CALL_PREFIX.matcher(source);
        if (!prefix.find()) {
            return Optional.empty();
        }
        int open = prefix.end() - 1;
        int close = findClosingParen(source, open);
        if (close != source.length() - 1) {
            return Optional.empty();
        }

        List<String> args = splitArguments(source.substring(open + 1, close));
        if (args.size() < 2) {
            return Optional.empty();
        }
        String pattern = stripQuotes(preprocessor.replaceFieldReferences(args.get(0)));
        String subject = preprocessor.replaceFieldReferences(args.get(1)).trim();

        if (isLogical(pattern)) {
            return Optional.of(ConstraintMatch.supported(name(), preprocessor.lowercaseBooleanKeywords(pattern)));
        }
        if (looksLikePattern(pattern) && FIELD.matcher(subject).matches()) {
            String field = subject.equals(".") ? "self" : FieldNames.sanitize(subject);
            return Optional.of(ConstraintMatch.supported(name(), "regexMatch(" + quote(pattern) + ", " + field + ")"));
        }
        return Optional.of(ConstraintMatch.unsupported(
                name(), "regexMatch", "regexMatch() arguments are not a pattern followed by a field reference"));
    }

    /** Index of the parenthesis closing the one at {@code open}, or -1 if unbalanced. */
    static int findClosingParen(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote && text.charAt(i - 1) != '\\') {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** Splits on commas outside quotes and nested parentheses. Each argument is trimmed. */
    static List<String> splitArguments(String text) {
        List<String> args = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote && text.charAt(i - 1) != '\\') {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                args.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (!current.toString().isBlank()) {
            args.add(current.toString().trim());
        }
        return args;
    }

    private static boolean isLogical(String argument) {
        String bare = CHARACTER_CLASS.matcher(argument).replaceAll("");
        bare = GROUP_PREFIX.matcher(bare).replaceAll("");
        return COMPARISON.matcher(bare).find() || BOOLEAN_KEYWORD.matcher(bare).find();
    }

    private static boolean looksLikePattern(String argument) {
        return argument.indexOf('^') >= 0
                || argument.indexOf('$') >= 0
                || CHARACTER_CLASS.matcher(argument).find();
    }

    private static String stripQuotes(String argument) {
        String trimmed = argument.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            if ((first == '"' || first == '\'') && trimmed.charAt(trimmed.length() - 1) == first) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    private static String quote(String pattern) {
        return pattern.indexOf('\'') < 0 ? "'" + pattern + "'" : "\"" + pattern + "\"";
    }
}
