package com.williamcallahan.mathtext.service.formatting;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the fraction spellings found in generated content to {@code {numerator/denominator}}
 * and makes implicit fraction multiplication explicit.
 */
public final class FractionNormalizer {
    /** Division slash used to keep word ratios such as "rise/run" from reading as fractions. */
    static final char RATIO_SLASH = '∕';

    private static final Pattern ABSOLUTE_URI = Pattern.compile("(?i)\\b(?:file|https?):/{2,3}[^\\s)]+");
    private static final Pattern WORD_RATIO = Pattern.compile("\\b([a-zA-Z]+)/([a-zA-Z]+)\\b");
    private static final Pattern PAREN_NUMERIC_FRACTION = Pattern.compile("\\((\\d+)\\s*/\\s*(\\d+)\\)");
    private static final Pattern PAREN_TERM_FRACTION = Pattern.compile("\\((-?\\d*[a-zA-Z]+)\\s*/\\s*(\\d+)\\)");
    private static final Pattern PAREN_NEGATIVE_FRACTION = Pattern.compile("\\((-\\d+)\\s*/\\s*(\\d+)\\)");

    private static final Map<Character, String> VULGAR_FRACTIONS = Map.ofEntries(
            Map.entry('½', "{1/2}"), Map.entry('⅓', "{1/3}"), Map.entry('⅔', "{2/3}"),
            Map.entry('¼', "{1/4}"), Map.entry('¾', "{3/4}"), Map.entry('⅕', "{1/5}"),
            Map.entry('⅖', "{2/5}"), Map.entry('⅗', "{3/5}"), Map.entry('⅘', "{4/5}"),
            Map.entry('⅙', "{1/6}"), Map.entry('⅚', "{5/6}"), Map.entry('⅛', "{1/8}"),
            Map.entry('⅜', "{3/8}"), Map.entry('⅝', "{5/8}"), Map.entry('⅞', "{7/8}"));
    private static final Pattern PAREN_OVER_PAREN = Pattern.compile(
            "\\((\\d+(?:\\.\\d+)?)\\)\\s*/\\s*\\((\\d+(?:\\.\\d+)?)\\)");
    private static final Pattern INLINE_SMALL_FRACTION = Pattern.compile(
            "(\\s|^|=|\\()(\\d{1,2})/(\\d{1,2})(\\s|$|[a-zA-Z]|\\*|\\)|,|\\.)");

    private static final Pattern PADDED_FRACTION = Pattern.compile("\\{\\s*([^}/]+?)\\s*/\\s*([^}]+?)\\s*\\}");
    private static final Pattern FRACTION_BEFORE_DIGIT = Pattern.compile("\\{(\\d+\\s*/\\s*\\d+)\\}\\s*(\\d)");
    private static final Pattern FRACTION_BEFORE_PAREN = Pattern.compile("\\{(\\d+\\s*/\\s*\\d+)\\}\\s*\\(");
    private static final Pattern FRACTION_BEFORE_ASTERISK = Pattern.compile(
            "\\{(\\d+\\s*/\\s*\\d+)\\}\\s*\\*(?![a-zA-Z][a-zA-Z0-9_]*\\*)\\s*");
    private static final Pattern BRACE_BEFORE_DIGIT = Pattern.compile("\\}(\\d)");
    private static final Pattern BRACE_BEFORE_PAREN = Pattern.compile("\\}\\(");

    private static final Pattern CLOSING_BRACE_ON_NEXT_LINE = Pattern.compile("\\{([^}]+)\\n\\s*\\}");
    private static final Pattern SPLIT_FRACTION_BEFORE_CLOSE = Pattern.compile("\\{([^}/]+)/([^}]+)\\n\\s*\\}");
    private static final Pattern SPACE_AFTER_OPEN_BRACE = Pattern.compile("\\{\\s+");
    private static final Pattern SPACE_BEFORE_CLOSE_BRACE = Pattern.compile("\\s+\\}");
    private static final Pattern BRACE_CONTENT_TO_LINE_END = Pattern.compile("\\{([^}]+)\\s*\\n");
    private static final Pattern UNCLOSED_FRACTION = Pattern.compile("\\{([^}]+/[^}]+)(\\s|$|,|\\.|;|\\))");

    private FractionNormalizer() {}

    /**
     * Converts parenthesized fractions such as {@code (3/4)}, {@code (x/2)} and {@code (-3/4)} to
     * brace form. Absolute URIs are left untouched and word ratios get a division slash instead.
     */
    public static String normalizeFractionForms(String text) {
        if (text.indexOf('/') < 0) {
            return text;
        }
        MaskArena arena = new MaskArena();
        String result = arena.maskAll(text, ABSOLUTE_URI);
        result = WORD_RATIO.matcher(result).replaceAll("$1" + RATIO_SLASH + "$2");
        result = PAREN_NUMERIC_FRACTION.matcher(result).replaceAll("{$1/$2}");
        result = PAREN_TERM_FRACTION.matcher(result).replaceAll("{$1/$2}");
        result = PAREN_NEGATIVE_FRACTION.matcher(result).replaceAll("{$1/$2}");
        return arena.restore(result);
    }

    /**
     * Converts vulgar fraction characters, {@code (a)/(b)} and short inline {@code n/m} fractions.
     */
    static String convertRawFractions(String text) {
        StringBuilder converted = new StringBuilder(text.length() + 8);
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            String replacement = VULGAR_FRACTIONS.get(current);
            if (replacement != null) {
                converted.append(replacement);
            } else {
                converted.append(current);
            }
        }
        String result = PAREN_OVER_PAREN.matcher(converted).replaceAll("{$1/$2}");
        return INLINE_SMALL_FRACTION.matcher(result).replaceAll("$1{$2/$3}$4");
    }

    /**
     * Trims whitespace inside fraction braces: {@code { 3 / 4 }} becomes {@code {3/4}}.
     */
    public static String normalizeFractionWhitespace(String text) {
        Matcher matcher = PADDED_FRACTION.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String numerator = matcher.group(1).trim();
            String denominator = matcher.group(2).trim();
            matcher.appendReplacement(result, Matcher.quoteReplacement("{" + numerator + "/" + denominator + "}"));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Makes multiplication explicit after a numeric fraction followed by a digit, a parenthesis or
     * a multiplication asterisk. A fraction followed by a letter or an italic variable such as
     * {@code *m*} is a coefficient and stays as written.
     */
    public static String normalizeFractionMultiplication(String text) {
        String result = FRACTION_BEFORE_DIGIT.matcher(text).replaceAll("{$1} × $2");
        result = FRACTION_BEFORE_PAREN.matcher(result).replaceAll("{$1} × (");
        return FRACTION_BEFORE_ASTERISK.matcher(result).replaceAll("{$1} × ");
    }

    /**
     * Inserts {@code ×} between any closing brace and a directly following digit or parenthesis.
     */
    static String normalizeAdjacentFractions(String text) {
        String result = BRACE_BEFORE_DIGIT.matcher(text).replaceAll("} × $1");
        return BRACE_BEFORE_PAREN.matcher(result).replaceAll("} × (");
    }

    /**
     * Repairs fraction braces damaged by line wrapping or left unclosed.
     */
    static String repairMalformedBraces(String text) {
        if (text.indexOf('{') < 0) {
            return text;
        }
        String result = CLOSING_BRACE_ON_NEXT_LINE.matcher(text).replaceAll("{$1}");
        result = SPLIT_FRACTION_BEFORE_CLOSE.matcher(result).replaceAll("{$1/$2}");
        result = SPACE_AFTER_OPEN_BRACE.matcher(result).replaceAll("{");
        result = SPACE_BEFORE_CLOSE_BRACE.matcher(result).replaceAll("}");
        result = BRACE_CONTENT_TO_LINE_END.matcher(result).replaceAll("{$1}");
        return UNCLOSED_FRACTION.matcher(result).replaceAll("{$1}$2");
    }
}
