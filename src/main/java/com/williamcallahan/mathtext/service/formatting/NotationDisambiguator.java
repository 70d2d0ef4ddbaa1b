package com.williamcallahan.mathtext.service.formatting;

import java.util.regex.Pattern;

/**
 * Separates the two meanings of {@code *}: italic identifier markers and multiplication.
 */
public final class NotationDisambiguator {
    private static final Pattern ITALIC_IDENTIFIER = Pattern.compile("\\*([a-zA-Z][a-zA-Z0-9_]*)\\*");
    private static final Pattern MULTIPLICATION_ASTERISK = Pattern.compile(
            "([0-9a-zA-Z}\\)\\]])[ \\t]*\\*[ \\t]*(?=[0-9a-zA-Z{\\(\\[\\-])");

    private NotationDisambiguator() {}

    /**
     * Converts multiplication asterisks to {@code ×} while leaving {@code *x*} italics untouched.
     *
     * <p>{@code {3/4}*8} becomes {@code {3/4} × 8}, {@code 2*x* + 1} is unchanged. Both operands
     * must be on the asterisk's own line, so a bullet at the start of a line stays a bullet.</p>
     */
    public static String disambiguateAsterisks(String text) {
        if (text.indexOf('*') < 0) {
            return text;
        }
        MaskArena arena = new MaskArena();
        String masked = arena.maskAll(text, ITALIC_IDENTIFIER);
        String converted = MULTIPLICATION_ASTERISK.matcher(masked).replaceAll("$1 × ");
        return arena.restore(converted);
    }
}
