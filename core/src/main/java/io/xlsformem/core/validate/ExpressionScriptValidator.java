package io.xlsformem.core.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static checker for Expression Manager syntax. Reports findings as human-readable strings; an
 * empty list means the expression looks valid. Used after conversion as an advisory check, and
 * usable on its own for hand-written EM code.
 *
 * <p>
 * Checks, in order: parenthesis balance, quote balance, bracket balance, function names,
 * operator tokens, variable names. Everything except the quote check ignores text inside string
 * literals. A regex literal ({@code /.../flags}) is only checked for balance.
 */
public final class ExpressionScriptValidator {

    private static final Set<String> SUPPORTED_FUNCTIONS = Set.of(
            // math
            "abs", "acos", "asin", "atan", "atan2", "ceil", "cos", "exp", "floor", "intval", "floatval",
            "log", "max", "min", "pi", "pow", "rand", "round", "sin", "sqrt", "tan", "fixnum", "number_format",
            // aggregates
            "count", "countif", "countifop", "sum", "sumifop", "avg", "median", "stddev", "variance", "unique",
            // strings
            "len", "strlen", "substr", "strpos", "stripos", "strstr", "contains", "startsWith", "endsWith",
            "concat", "upper", "lower", "strtolower", "strtoupper", "ucwords", "trim", "ltrim", "rtrim",
            "replace", "str_replace", "sprintf", "implode", "join", "list", "nl2br", "htmlspecialchars",
            "htmlentities", "html_entity_decode",
            // dates
            "today", "now", "date", "time", "datetime", "formatDate", "mktime", "checkdate",
            // logic and type tests
            "if", "iif", "coalesce", "isEmpty", "is_empty", "isNull", "is_null", "isNumeric", "is_numeric",
            "is_int", "is_float", "is_string", "is_nan",
            // patterns
            "regexMatch", "regexReplace");

    private static final Set<String> SUPPORTED_OPERATORS = Set.of(
            "==", "!=", "<", ">", "<=", ">=", "&&", "||", "!", "+", "-", "*", "/", "%", "^", "=", "?", ":");

    private static final Set<String> RESERVED_KEYWORDS = Set.of("self", "that", "this", "true", "false", "null", "NA");

    private static final Set<String> WORD_OPERATORS = Set.of("and", "or");

    private static final Pattern REGEX_LITERAL = Pattern.compile("^/.*/[a-z]*$", Pattern.DOTALL);

    private static final Pattern FUNCTION_CALL = Pattern.compile("(\\w+)\\s*\\(");

    private static final Pattern OPERATOR_RUN = Pattern.compile("[=!<>&|+\\-*/%^?:]+");

    private static final Pattern DIGIT_LED_NAME = Pattern.compile("\\b(\\d[\\w$]*)\\b");

    private static final Pattern NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");

    /**
     * Validates an expression.
     *
     * @param expression the EM expression, may be {@code null}
     * @return the findings, empty when valid; blank input is valid
     */
    public List<String> validate(String expression) {
        List<String> errors = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return errors;
        }

        String masked = maskStringLiterals(expression);
        checkBalance(masked, '(', ')', "Unbalanced parentheses", errors);
        checkQuotes(expression, errors);
        checkBalance(masked, '[', ']', "Unbalanced brackets", errors);

        if (REGEX_LITERAL.matcher(expression.trim()).matches()) {
            return errors;
        }

        checkFunctions(masked, errors);
        checkOperators(masked, errors);
        checkVariableNames(masked, errors);
        return errors;
    }

    public boolean isValid(String expression) {
        return validate(expression).isEmpty();
    }

    public List<String> supportedFunctions() {
        return List.copyOf(new TreeSet<>(SUPPORTED_FUNCTIONS));
    }

    public List<String> supportedOperators() {
        return List.copyOf(new TreeSet<>(SUPPORTED_OPERATORS));
    }

    public List<String> reservedKeywords() {
        return List.copyOf(new TreeSet<>(RESERVED_KEYWORDS));
    }

    private static void checkBalance(String text, char open, char close, String message, List<String> errors) {
        int balance = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == open) {
                balance++;
            } else if (c == close) {
                balance--;
            }
        }
        if (balance != 0) {
            errors.add(message);
        }
    }

    private static void checkQuotes(String expression, List<String> errors) {
        char quote = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (quote == 0) {
                if (c == '\'' || c == '"') {
                    quote = c;
                }
            } else if (c == '\\') {
                i++;
            } else if (c == quote) {
                quote = 0;
            }
        }
        if (quote == '\'') {
            errors.add("Unbalanced single quotes");
        } else if (quote == '"') {
            errors.add("Unbalanced double quotes");
        }
    }

    private static void checkFunctions(String masked, List<String> errors) {
        Matcher matcher = FUNCTION_CALL.matcher(masked);
        while (matcher.find()) {
            int start = matcher.start(1);
            if (start > 0) {
                char previous = masked.charAt(start - 1);
                if (Character.isLetterOrDigit(previous) || previous == '_' || previous == '$') {
                    continue;
                }
            }
            String name = matcher.group(1);
            if (!SUPPORTED_FUNCTIONS.contains(name)
                    && !RESERVED_KEYWORDS.contains(name)
                    && !WORD_OPERATORS.contains(name)) {
                errors.add("Unsupported function: " + name);
            }
        }
    }

    /** A run is valid when it is a known operator, optionally followed by unary {@code - ! +}. */
    private static void checkOperators(String masked, List<String> errors) {
        Matcher matcher = OPERATOR_RUN.matcher(masked);
        while (matcher.find()) {
            String run = matcher.group();
            String head = run;
            while (!SUPPORTED_OPERATORS.contains(head) && head.length() > 1 && isUnary(head.charAt(head.length() - 1))) {
                head = head.substring(0, head.length() - 1);
            }
            if (!SUPPORTED_OPERATORS.contains(head)) {
                errors.add("Unsupported operator: " + run);
            }
        }
    }

    private static boolean isUnary(char c) {
        return c == '-' || c == '!' || c == '+';
    }

    private static void checkVariableNames(String masked, List<String> errors) {
        Matcher matcher = DIGIT_LED_NAME.matcher(masked);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!NUMBER.matcher(name).matches()) {
                errors.add("Invalid variable name: " + name);
            }
        }
    }

    /**
     * Replaces the contents of string literals with spaces, keeping the quotes and the string
     * length, so later checks only see code. An unterminated literal masks to the end.
     */
    static String maskStringLiterals(String expression) {
        StringBuilder masked = new StringBuilder(expression.length());
        char quote = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (quote == 0) {
                if (c == '\'' || c == '"') {
                    quote = c;
                }
                masked.append(c);
            } else if (c == '\\' && i + 1 < expression.length()) {
                masked.append("  ");
                i++;
            } else if (c == quote) {
                quote = 0;
                masked.append(c);
            } else {
                masked.append(' ');
            }
        }
        return masked.toString();
    }
}
