package com.williamcallahan.mathtext.service.formatting;

import java.util.regex.Pattern;

/**
 * Removes LaTeX delimiters and rewrites the handful of LaTeX commands that have a plain
 * equivalent in the inline notation.
 */
final class LatexNotationStripper {
    private static final Pattern MATH_DELIMITER = Pattern.compile("\\\\[\\[\\]()]");
    private static final Pattern ESCAPED_OPEN_BRACE = Pattern.compile("\\\\\\{");
    private static final Pattern ESCAPED_CLOSE_BRACE = Pattern.compile("\\\\\\}");
    private static final Pattern TEXT_COMMAND = Pattern.compile("\\\\text\\{([^}]+)\\}");
    private static final Pattern FRAC_COMMAND = Pattern.compile("\\\\frac\\{([^}]+)\\}\\{([^}]+)\\}");
    private static final Pattern TIMES_COMMAND = Pattern.compile("\\\\times");
    private static final Pattern CDOT_COMMAND = Pattern.compile("\\\\cdot");
    private static final Pattern DIV_COMMAND = Pattern.compile("\\\\div");
    private static final Pattern SQRT_COMMAND = Pattern.compile("\\\\sqrt");

    private LatexNotationStripper() {}

    static String stripLatex(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        String result = MATH_DELIMITER.matcher(text).replaceAll("");
        result = ESCAPED_OPEN_BRACE.matcher(result).replaceAll("{");
        result = ESCAPED_CLOSE_BRACE.matcher(result).replaceAll("}");
        result = TEXT_COMMAND.matcher(result).replaceAll("$1");
        result = FRAC_COMMAND.matcher(result).replaceAll("{$1/$2}");
        result = TIMES_COMMAND.matcher(result).replaceAll("×");
        result = CDOT_COMMAND.matcher(result).replaceAll("·");
        result = DIV_COMMAND.matcher(result).replaceAll("÷");
        return SQRT_COMMAND.matcher(result).replaceAll("√");
    }
}
