package com.williamcallahan.mathtext.service.formatting;

import java.util.regex.Pattern;

/**
 * Canonicalizes structural labels and moves them onto their own lines.
 */
public final class LabelIsolator {
    private static final Pattern LEFT_LABEL_VARIANTS = Pattern.compile(
            "\\b(?:Left-hand-side|Left-hand side|Left side):", Pattern.CASE_INSENSITIVE);
    private static final Pattern RIGHT_LABEL_VARIANTS = Pattern.compile(
            "\\b(?:Right-hand-side|Right-hand side|Right side):", Pattern.CASE_INSENSITIVE);
    private static final String ISOLATED_LABEL_NAMES = "Left Side:|Right Side:|LHS:|RHS:|Step \\d+:"
            + "|Original equation:|Simplified:|Therefore:|Hence:|Thus:|Equation after simplifying[^:\\n]*:";
    private static final Pattern ISOLATED_LABEL = Pattern.compile(
            "\\s*\\b(" + ISOLATED_LABEL_NAMES + ")\\s*", Pattern.CASE_INSENSITIVE);

    /** A label as {@link #isolateLabels(String)} leaves it, with its surrounding line breaks. */
    static final Pattern ISOLATED_LABEL_BLOCK = Pattern.compile(
            "(?:\\A|\\n\\n)(?:" + ISOLATED_LABEL_NAMES + ")\\n", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern LEADING_NEWLINES = Pattern.compile("^\\n+");

    private static final String LABEL_NAMES = "Left-hand side|Right-hand side|Left-hand-side|Right-hand-side"
            + "|Left side|Right side|LHS|RHS|Step \\d+|Part [a-zA-Z]|Case \\d+|Solution|Answer|Result|Given"
            + "|Find|Proof|Example|Original equation|Simplified|Therefore|Hence|Thus"
            + "|Equation after simplifying[^:]*";
    private static final Pattern LABEL_LINE = Pattern.compile(
            "^(?:" + LABEL_NAMES + "):", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_LABEL = Pattern.compile(
            "^\\s*(?:" + LABEL_NAMES + ")\\s*:\\s*", Pattern.CASE_INSENSITIVE);

    private LabelIsolator() {}

    /**
     * Rewrites left/right label variants to "Left Side:"/"Right Side:" and isolates every
     * recognized label with a blank line before it and a line break after it.
     */
    public static String isolateLabels(String text) {
        String result = LEFT_LABEL_VARIANTS.matcher(text).replaceAll("Left Side:");
        result = RIGHT_LABEL_VARIANTS.matcher(result).replaceAll("Right Side:");
        result = ISOLATED_LABEL.matcher(result).replaceAll("\n\n$1\n");
        result = EXCESS_BLANK_LINES.matcher(result).replaceAll("\n\n");
        return LEADING_NEWLINES.matcher(result).replaceAll("");
    }

    /**
     * Reports whether a line starts with a structural label.
     */
    public static boolean isLabelLine(String line) {
        return LABEL_LINE.matcher(line.trim()).find();
    }

    /**
     * Removes a structural label from the start of a line, if there is one.
     */
    public static String stripLeadingLabel(String line) {
        return LEADING_LABEL.matcher(line).replaceFirst("");
    }
}
