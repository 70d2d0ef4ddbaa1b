package com.williamcallahan.mathtext.domain.formatting;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Colors accepted inside {@code [color:text]} tags.
 */
public enum HighlightColor {
    RED("red"),
    BLUE("blue"),
    GREEN("green"),
    ORANGE("orange"),
    PURPLE("purple"),
    YELLOW("yellow"),
    TEAL("teal"),
    INDIGO("indigo"),
    PINK("pink"),
    DEFAULT("default");

    /** Regex alternation of the named colors, for tag patterns. */
    public static final String TAG_ALTERNATION = "red|blue|green|orange|purple|yellow|teal|indigo|pink";

    private final String token;

    HighlightColor(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Resolves a color from a tag name, ignoring case.
     *
     * @param rawToken color name taken from a tag
     * @return the matching color, or empty when the name is unknown
     */
    public static Optional<HighlightColor> fromToken(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return Optional.empty();
        }
        String normalized = rawToken.trim().toLowerCase(Locale.ROOT);
        for (HighlightColor color : values()) {
            if (color.token.equals(normalized)) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a color from a tag name, falling back to {@link #DEFAULT}.
     */
    public static HighlightColor fromTokenOrDefault(String rawToken) {
        return fromToken(rawToken).orElse(DEFAULT);
    }
}
