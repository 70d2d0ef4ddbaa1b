package com.williamcallahan.mathtext.service.formatting;

import com.williamcallahan.mathtext.domain.formatting.FormattingDiagnostic;
import java.util.Objects;

/**
 * Signals that formatted output still contained an internal marker while running in strict mode.
 */
public class ContractViolationException extends IllegalStateException {
    private final transient FormattingDiagnostic diagnostic;

    /**
     * Creates a contract violation for the first leaked marker found.
     *
     * @param diagnostic description of the leak
     */
    public ContractViolationException(FormattingDiagnostic diagnostic) {
        super("Formatted output leaked an internal marker: " + diagnostic.describe());
        this.diagnostic = Objects.requireNonNull(diagnostic, "Diagnostic is required");
    }

    public FormattingDiagnostic getDiagnostic() {
        return diagnostic;
    }
}
