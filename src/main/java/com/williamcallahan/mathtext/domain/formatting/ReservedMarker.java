package com.williamcallahan.mathtext.domain.formatting;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Internal sentinel shapes that must never appear in canonical output.
 *
 * <p>The first three entries are the sentinels the pipeline itself issues. The rest are token
 * shapes produced by earlier generations of the formatter that still turn up in stored content,
 * so they are scrubbed from input and guarded against in output. Declaration order is scrub order:
 * more specific shapes come before the ones they contain.</p>
 */
public enum ReservedMarker {
    MASK_KEY("\uE000M\\d+\uE001"),
    PARAGRAPH_BREAK("\uE000P\uE001"),
    ITALIC_MASK("IMASK\\d+IMASK"),
    NUMBERED_MASK("_?MASK\\d+_?"),
    PLACEHOLDER("PLACEHOLDER[_\\d]+"),
    IMAGE_PROTECTION("XXIMAGEPROTECTED\\d*XX"),
    BRACKETED_PROTECTION("〔PROTECTED\\d+〕"),
    LIST_BREAK("LIST_BREAK"),
    STEP_BREAK("⟪STEP⟫"),
    ITALIC_PLACEHOLDER("<<ITALIC_\\d+>>"),
    FILE_URL_PLACEHOLDER("__FILE_URL_\\d+__"),
    SENTINEL_DELIMITER("[\uE000\uE001]");

    private final Pattern pattern;

    ReservedMarker(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    public Pattern pattern() {
        return pattern;
    }

    /**
     * Finds the first reserved marker occurrence in the given text.
     *
     * @param text text to inspect
     * @return the marker kind and matched token, or empty when the text is clean
     */
    public static Optional<MarkerOccurrence> findFirst(CharSequence text) {
        if (text == null || text.length() == 0) {
            return Optional.empty();
        }
        MarkerOccurrence earliest = null;
        for (ReservedMarker marker : values()) {
            Matcher matcher = marker.pattern.matcher(text);
            if (matcher.find() && (earliest == null || matcher.start() < earliest.position())) {
                earliest = new MarkerOccurrence(marker, matcher.group(), matcher.start());
            }
        }
        return Optional.ofNullable(earliest);
    }

    /**
     * Reports whether any reserved marker occurs in the given text.
     */
    public static boolean anyPresent(CharSequence text) {
        return findFirst(text).isPresent();
    }

    /**
     * One located reserved marker.
     *
     * @param marker marker kind
     * @param token matched text
     * @param position zero-based offset of the match
     */
    public record MarkerOccurrence(ReservedMarker marker, String token, int position) {
    }
}
