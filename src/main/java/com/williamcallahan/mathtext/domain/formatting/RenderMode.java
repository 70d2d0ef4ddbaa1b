package com.williamcallahan.mathtext.domain.formatting;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Selects how much structural repair the canonicalizer applies to a piece of text.
 */
public enum RenderMode {
    /**
     * Single-line heading text: line breaks and whitespace runs collapse to single spaces.
     */
    TITLE("title"),

    /**
     * Free-flowing paragraph text: line breaks become spaces.
     */
    PROSE("prose"),

    /**
     * Multi-line mathematical content that receives the full repair pipeline.
     */
    EQUATION("equation");

    private final String token;

    RenderMode(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Resolves a mode from its wire token, ignoring case.
     *
     * @param rawToken token such as "title" or "EQUATION"
     * @return matching mode, or empty when the token is unknown
     */
    public static Optional<RenderMode> fromToken(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return Optional.empty();
        }
        String normalized = rawToken.trim().toLowerCase(Locale.ROOT);
        for (RenderMode mode : values()) {
            if (mode.token.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
