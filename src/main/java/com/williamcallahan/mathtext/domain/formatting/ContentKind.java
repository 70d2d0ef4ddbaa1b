package com.williamcallahan.mathtext.domain.formatting;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Coarse classification of a content field, used to choose a formatting route.
 */
public enum ContentKind {
    CODE,
    MATH,
    LIST,
    PROSE;

    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
