package com.williamcallahan.mathtext.service.formatting;

import com.williamcallahan.mathtext.domain.formatting.CanonicalText;
import com.williamcallahan.mathtext.domain.formatting.FormattingDiagnostic;
import com.williamcallahan.mathtext.domain.formatting.FormattingMode;
import com.williamcallahan.mathtext.domain.formatting.FormattingResult;
import com.williamcallahan.mathtext.domain.formatting.RenderMode;
import com.williamcallahan.mathtext.domain.formatting.ReservedMarker;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last line of defense against internal markers reaching users.
 *
 * <p>Input is scrubbed of every reserved marker before processing, so a marker found in output
 * means a stage leaked one. Strict mode turns that into a {@link ContractViolationException};
 * lenient mode strips the marker, repairs spacing and records a diagnostic.</p>
 */
public final class LeakGuard {
    private static final Logger logger = LoggerFactory.getLogger(LeakGuard.class);

    private static final Pattern HORIZONTAL_SPACE_RUN = Pattern.compile("[ \\t]{2,}");
    private static final Pattern LINE_EDGE_SPACE = Pattern.compile("(?m)^[ \\t]+|[ \\t]+$");

    private LeakGuard() {}

    /**
     * Removes every reserved marker from the text and collapses the spacing left behind.
     * Text without markers is returned unchanged.
     */
    public static String scrubReservedMarkers(String text) {
        if (text == null || text.isEmpty() || !ReservedMarker.anyPresent(text)) {
            return text == null ? "" : text;
        }
        String scrubbed = text;
        for (ReservedMarker marker : ReservedMarker.values()) {
            scrubbed = marker.pattern().matcher(scrubbed).replaceAll(" ");
        }
        scrubbed = HORIZONTAL_SPACE_RUN.matcher(scrubbed).replaceAll(" ");
        return LINE_EDGE_SPACE.matcher(scrubbed).replaceAll("").trim();
    }

    /**
     * Removes every reserved marker and key delimiter without touching any other character, for
     * text such as code whose whitespace is significant.
     */
    public static String stripReservedMarkersKeepingLayout(String text) {
        if (text == null) {
            return null;
        }
        String stripped = text;
        for (ReservedMarker marker : ReservedMarker.values()) {
            if (marker != ReservedMarker.SENTINEL_DELIMITER) {
                stripped = marker.pattern().matcher(stripped).replaceAll("");
            }
        }
        return MaskArena.stripKeyDelimiters(stripped);
    }

    /**
     * Lists reserved marker occurrences by position. A match nested inside a longer one, such as
     * a delimiter inside a mask key, is reported once as the longer match.
     */
    static List<FormattingDiagnostic> scan(String text, String context) {
        List<FormattingDiagnostic> diagnostics = new ArrayList<>();
        for (ReservedMarker marker : ReservedMarker.values()) {
            Matcher matcher = marker.pattern().matcher(text);
            while (matcher.find()) {
                diagnostics.add(new FormattingDiagnostic(marker, matcher.group(), matcher.start(), context));
            }
        }
        diagnostics.sort(Comparator.comparingInt(FormattingDiagnostic::position)
                .thenComparing(Comparator.comparingInt((FormattingDiagnostic found) -> found.token().length()).reversed()));
        List<FormattingDiagnostic> distinct = new ArrayList<>();
        int coveredUntil = 0;
        for (FormattingDiagnostic diagnostic : diagnostics) {
            if (diagnostic.position() >= coveredUntil) {
                distinct.add(diagnostic);
                coveredUntil = diagnostic.position() + diagnostic.token().length();
            }
        }
        return distinct;
    }

    /**
     * Wraps stage output as canonical text, enforcing the no-marker guarantee.
     *
     * @param text pipeline output
     * @param renderMode mode the text was produced for
     * @param formattingMode whether a leak fails the call or is stripped
     * @param context label for the field being formatted, used in diagnostics
     * @return canonical text plus any diagnostics raised in lenient mode
     * @throws ContractViolationException when a marker leaked in strict mode
     */
    static FormattingResult finalizeText(
            String text, RenderMode renderMode, FormattingMode formattingMode, String context) {
        List<FormattingDiagnostic> diagnostics = scan(text, context);
        if (diagnostics.isEmpty()) {
            return FormattingResult.clean(CanonicalText.of(text, renderMode));
        }
        if (formattingMode == FormattingMode.STRICT) {
            throw new ContractViolationException(diagnostics.get(0));
        }
        for (FormattingDiagnostic diagnostic : diagnostics) {
            logger.warn("Stripped leaked marker from formatted output: {}", diagnostic.describe());
        }
        return new FormattingResult(CanonicalText.of(scrubReservedMarkers(text), renderMode), diagnostics);
    }
}
