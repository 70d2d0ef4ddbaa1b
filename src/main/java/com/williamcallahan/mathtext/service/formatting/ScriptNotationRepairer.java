package com.williamcallahan.mathtext.service.formatting;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rewrites Unicode super/subscripts to caret and underscore notation and closes scripts
 * that were left open.
 */
final class ScriptNotationRepairer {
    private static final Map<Character, String> UNICODE_SCRIPTS = Map.ofEntries(
            Map.entry('⁰', "^0^"), Map.entry('¹', "^1^"), Map.entry('²', "^2^"), Map.entry('³', "^3^"),
            Map.entry('⁴', "^4^"), Map.entry('⁵', "^5^"), Map.entry('⁶', "^6^"), Map.entry('⁷', "^7^"),
            Map.entry('⁸', "^8^"), Map.entry('⁹', "^9^"), Map.entry('⁺', "^+^"), Map.entry('⁻', "^-^"),
            Map.entry('₀', "_0_"), Map.entry('₁', "_1_"), Map.entry('₂', "_2_"), Map.entry('₃', "_3_"),
            Map.entry('₄', "_4_"), Map.entry('₅', "_5_"), Map.entry('₆', "_6_"), Map.entry('₇', "_7_"),
            Map.entry('₈', "_8_"), Map.entry('₉', "_9_"));

    private static final Pattern PARENTHESIZED_EXPONENT = Pattern.compile("\\^\\((-?\\d+)\\)");
    private static final Pattern UNCLOSED_SUPERSCRIPT = Pattern.compile(
            "([a-zA-Z\\d.)\\]]+)\\^(\\d{1,2}|[+\\-]|\\w{1,3})(?!\\^)(\\s|,|\\.|\\]|\\)|=|$|:|/)");
    private static final Pattern UNCLOSED_SUBSCRIPT = Pattern.compile(
            "([a-zA-Z])_([a-zA-Z]+\\d*|\\d{1,2})(?!_)(\\s|,|\\.|\\]|\\)|=|$|:)");

    private ScriptNotationRepairer() {}

    /**
     * Replaces Unicode superscript and subscript characters with {@code ^n^} and {@code _n_}.
     */
    static String convertUnicodeScripts(String text) {
        StringBuilder converted = null;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            String replacement = UNICODE_SCRIPTS.get(current);
            if (replacement != null && converted == null) {
                converted = new StringBuilder(text.length() + 8).append(text, 0, index);
            }
            if (converted != null) {
                converted.append(replacement != null ? replacement : String.valueOf(current));
            }
        }
        return converted == null ? text : converted.toString();
    }

    /**
     * Closes scripts such as {@code x^2} or {@code v_initial} and rewrites {@code ^(-1)} to
     * {@code ^-1^}.
     */
    static String closeUnclosedScripts(String text) {
        String result = PARENTHESIZED_EXPONENT.matcher(text).replaceAll("^$1^");
        result = UNCLOSED_SUPERSCRIPT.matcher(result).replaceAll("$1^$2^$3");
        return UNCLOSED_SUBSCRIPT.matcher(result).replaceAll("$1_$2_$3");
    }
}
