package com.williamcallahan.mathtext.domain.equation;

import java.util.Locale;
import java.util.Objects;

/**
 * A validated two-sided equation.
 *
 * @param text normalized "left = right" rendering
 * @param left left-hand side, trimmed
 * @param right right-hand side, trimmed
 */
public record Equation(String text, String left, String right) {

    public Equation {
        Objects.requireNonNull(text, "Equation text is required");
        if (left == null || left.isBlank()) {
            throw new IllegalArgumentException("Equation left side cannot be blank");
        }
        if (right == null || right.isBlank()) {
            throw new IllegalArgumentException("Equation right side cannot be blank");
        }
    }

    /**
     * Builds an equation from its two sides, collapsing interior whitespace runs.
     */
    public static Equation of(String left, String right) {
        String normalizedLeft = collapse(left);
        String normalizedRight = collapse(right);
        return new Equation(normalizedLeft + " = " + normalizedRight, normalizedLeft, normalizedRight);
    }

    /**
     * Key used to treat equations that differ only by whitespace or case as duplicates.
     */
    public String dedupKey() {
        return text.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    private static String collapse(String side) {
        return side == null ? null : side.trim().replaceAll("\\s+", " ");
    }
}
