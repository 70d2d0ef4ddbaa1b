package com.williamcallahan.mathtext.domain.formatting;

/**
 * Records a reserved marker that survived formatting and was stripped in lenient mode.
 *
 * @param marker marker kind that leaked
 * @param token the leaked text
 * @param position offset of the leak in the pre-strip output
 * @param context caller-supplied label for the field being formatted
 */
public record FormattingDiagnostic(
    ReservedMarker marker,
    String token,
    int position,
    String context
) {

    public FormattingDiagnostic {
        if (marker == null) {
            throw new IllegalArgumentException("Diagnostic marker cannot be null");
        }
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Diagnostic token cannot be null or empty");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Diagnostic position must be non-negative");
        }
        context = context == null ? "" : context;
    }

    /**
     * Human-readable summary suitable for a log line.
     */
    public String describe() {
        String where = context.isEmpty() ? "" : " in " + context;
        return marker + " leaked at position " + position + where;
    }
}
