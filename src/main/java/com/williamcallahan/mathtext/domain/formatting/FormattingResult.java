package com.williamcallahan.mathtext.domain.formatting;

import java.util.List;
import java.util.Objects;

/**
 * Canonical output together with any diagnostics raised while producing it.
 *
 * @param text canonical text
 * @param diagnostics reserved-marker leaks that were stripped in lenient mode
 */
public record FormattingResult(CanonicalText text, List<FormattingDiagnostic> diagnostics) {

    public FormattingResult {
        Objects.requireNonNull(text, "Canonical text is required");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static FormattingResult clean(CanonicalText text) {
        return new FormattingResult(text, List.of());
    }

    /**
     * Reports whether formatting finished without stripping any leaked marker.
     */
    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
