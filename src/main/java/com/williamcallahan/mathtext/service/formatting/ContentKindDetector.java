package com.williamcallahan.mathtext.service.formatting;

import com.williamcallahan.mathtext.domain.formatting.ContentKind;
import com.williamcallahan.mathtext.domain.formatting.HighlightColor;
import java.util.regex.Pattern;

/**
 * Classifies a content field so it can be routed to the right formatter.
 */
public final class ContentKindDetector {
    private static final String CODE_FENCE = "```";
    private static final Pattern CODE_LINE = Pattern.compile(
            "(?m)^\\s*(?:return\\b[^\\n]*;\\s*$|function\\s+\\w+\\s*\\(|def\\s+\\w+\\s*\\(|(?:const|let|var)\\s+\\w+\\s*=[^\\n]*;\\s*$)");
    private static final Pattern FRACTION = Pattern.compile("\\{[^}]*/[^}]*\\}");
    private static final Pattern COLOR_TAG = Pattern.compile(
            "(?i)\\[(?:" + HighlightColor.TAG_ALTERNATION + "):");
    private static final Pattern LIST_LINE = Pattern.compile("(?m)^\\s*(?:[A-D][.)]|\\d+[.)]|[-•])\\s+");

    private ContentKindDetector() {}

    /**
     * Detects the kind of a content field. Blank text counts as prose.
     */
    public static ContentKind detect(String text) {
        if (text == null || text.isBlank()) {
            return ContentKind.PROSE;
        }
        if (text.contains(CODE_FENCE) || CODE_LINE.matcher(text).find()) {
            return ContentKind.CODE;
        }
        if (text.indexOf('=') >= 0 || text.indexOf('^') >= 0
                || FRACTION.matcher(text).find() || COLOR_TAG.matcher(text).find()) {
            return ContentKind.MATH;
        }
        if (LIST_LINE.matcher(text).find()) {
            return ContentKind.LIST;
        }
        return ContentKind.PROSE;
    }
}
