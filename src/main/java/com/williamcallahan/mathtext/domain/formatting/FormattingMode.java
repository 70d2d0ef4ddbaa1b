package com.williamcallahan.mathtext.domain.formatting;

/**
 * Controls what happens when a reserved marker survives to the end of the pipeline.
 */
public enum FormattingMode {
    /**
     * Surviving markers fail the call with a contract violation.
     */
    STRICT,

    /**
     * Surviving markers are stripped, logged and reported as diagnostics.
     */
    LENIENT;

    public static FormattingMode of(boolean strict) {
        return strict ? STRICT : LENIENT;
    }
}
