package com.williamcallahan.mathtext.web;

import com.williamcallahan.mathtext.domain.formatting.FormattingDiagnostic;
import com.williamcallahan.mathtext.domain.formatting.RenderMode;
import java.util.List;

/**
 * Canonical text with any leak diagnostics raised while producing it.
 *
 * @param text canonical text
 * @param mode render mode applied
 * @param diagnostics stripped marker leaks, empty for clean output
 */
public record CanonicalizeResponse(String text, RenderMode mode, List<FormattingDiagnostic> diagnostics) {
    public CanonicalizeResponse {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
