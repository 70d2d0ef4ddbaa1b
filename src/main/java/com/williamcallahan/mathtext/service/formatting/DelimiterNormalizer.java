package com.williamcallahan.mathtext.service.formatting;

import java.util.regex.Pattern;

/**
 * Normalizes line breaks and removes those that fall inside open delimiters.
 */
public final class DelimiterNormalizer {
    private static final Pattern CRLF = Pattern.compile("\\r\\n?");
    private static final char LINE_SEPARATOR = '\u2028';
    private static final char PARAGRAPH_SEPARATOR = '\u2029';
    private static final char NEXT_LINE = '\u0085';

    private DelimiterNormalizer() {}

    /**
     * Maps every line-break variant to a single {@code \n}.
     */
    public static String normalizeLineBreaks(String text) {
        String normalized = CRLF.matcher(text).replaceAll("\n");
        return normalized.replace(LINE_SEPARATOR, '\n')
                .replace(PARAGRAPH_SEPARATOR, '\n')
                .replace(NEXT_LINE, '\n');
    }

    /**
     * Replaces line breaks that sit inside an unclosed (), {} or [] with a single space, together
     * with the spaces and tabs that follow them.
     *
     * <p>Depth counters never go negative, so an unmatched closing delimiter is ignored.</p>
     */
    public static String removeNewlinesInsideDelimiters(String text) {
        StringBuilder result = new StringBuilder(text.length());
        int parenDepth = 0;
        int braceDepth = 0;
        int bracketDepth = 0;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            switch (current) {
                case '(' -> parenDepth++;
                case ')' -> parenDepth = Math.max(0, parenDepth - 1);
                case '{' -> braceDepth++;
                case '}' -> braceDepth = Math.max(0, braceDepth - 1);
                case '[' -> bracketDepth++;
                case ']' -> bracketDepth = Math.max(0, bracketDepth - 1);
                default -> {
                }
            }
            boolean insideDelimiter = parenDepth > 0 || braceDepth > 0 || bracketDepth > 0;
            if (current == '\n' && insideDelimiter) {
                if (result.length() > 0 && result.charAt(result.length() - 1) != ' ') {
                    result.append(' ');
                }
                while (index + 1 < text.length() && isHorizontalSpace(text.charAt(index + 1))) {
                    index++;
                }
                continue;
            }
            result.append(current);
        }
        return result.toString();
    }

    private static boolean isHorizontalSpace(char character) {
        return character == ' ' || character == '\t';
    }

    /**
     * Reports whether any delimiter kind is left open or closed too often.
     */
    static boolean hasUnbalancedDelimiters(String text) {
        int parenDepth = 0;
        int braceDepth = 0;
        int bracketDepth = 0;
        for (int index = 0; index < text.length(); index++) {
            switch (text.charAt(index)) {
                case '(' -> parenDepth++;
                case ')' -> parenDepth--;
                case '{' -> braceDepth++;
                case '}' -> braceDepth--;
                case '[' -> bracketDepth++;
                case ']' -> bracketDepth--;
                default -> {
                }
            }
        }
        return parenDepth != 0 || braceDepth != 0 || bracketDepth != 0;
    }
}
