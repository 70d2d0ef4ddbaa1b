package com.williamcallahan.mathtext.domain.formatting;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Objects;

/**
 * Text that has passed through canonicalization for a given render mode.
 *
 * <p>Instances can only be created through {@link #of(String, RenderMode)}, which enforces the
 * output guarantees every consumer relies on: no reserved marker survives, title and prose text is
 * a single line, and no line break sits inside an open bracket, brace or parenthesis.</p>
 */
public final class CanonicalText {
    private static final char LINE_BREAK = '\n';

    private final String value;
    private final RenderMode mode;

    private CanonicalText(String value, RenderMode mode) {
        this.value = value;
        this.mode = mode;
    }

    /**
     * Wraps already-canonical text after checking the output guarantees.
     *
     * @param value canonical text
     * @param mode render mode the text was produced for
     * @return validated canonical text
     * @throws IllegalArgumentException when the text violates a guarantee
     */
    public static CanonicalText of(String value, RenderMode mode) {
        Objects.requireNonNull(value, "Canonical text value is required");
        Objects.requireNonNull(mode, "Render mode is required");
        ReservedMarker.findFirst(value).ifPresent(occurrence -> {
            throw new IllegalArgumentException("Canonical text contains reserved marker "
                    + occurrence.marker() + " at position " + occurrence.position());
        });
        if (mode != RenderMode.EQUATION && value.indexOf(LINE_BREAK) >= 0) {
            throw new IllegalArgumentException("Canonical " + mode.token() + " text must be a single line");
        }
        int brokenAt = lineBreakInsideOpenDelimiter(value);
        if (brokenAt >= 0) {
            throw new IllegalArgumentException(
                    "Canonical text has a line break inside an open delimiter at position " + brokenAt);
        }
        return new CanonicalText(value, mode);
    }

    /**
     * Returns empty canonical text for the given mode.
     */
    public static CanonicalText empty(RenderMode mode) {
        return new CanonicalText("", Objects.requireNonNull(mode, "Render mode is required"));
    }

    /**
     * Locates the first line break that sits inside an unclosed delimiter.
     *
     * <p>Depth counters never drop below zero, so a stray closing delimiter does not hide a
     * later opening one.</p>
     *
     * @param text text to scan
     * @return offset of the offending line break, or -1 when there is none
     */
    public static int lineBreakInsideOpenDelimiter(String text) {
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
                case LINE_BREAK -> {
                    if (parenDepth > 0 || braceDepth > 0 || bracketDepth > 0) {
                        return index;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public RenderMode mode() {
        return mode;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * Splits the text into its lines; title and prose text always yield a single line.
     */
    public List<String> lines() {
        return List.of(value.split("\n", -1));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CanonicalText that)) {
            return false;
        }
        return value.equals(that.value) && mode == that.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, mode);
    }

    @Override
    public String toString() {
        return value;
    }
}
