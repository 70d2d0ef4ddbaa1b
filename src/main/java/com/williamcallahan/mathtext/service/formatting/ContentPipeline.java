package com.williamcallahan.mathtext.service.formatting;

import com.williamcallahan.mathtext.domain.formatting.HighlightColor;
import java.util.regex.Pattern;

/**
 * Ordered repair stages for mathematical content.
 *
 * <p>{@link #formatContent(String)} is the full repair of free-form generated content;
 * {@link #structuralPass(String)} is the light pass that keeps equation blocks well formed.
 * Every call owns its own {@link MaskArena}.</p>
 */
final class ContentPipeline {
    static final Pattern IMAGE_REFERENCE = Pattern.compile("(?i)\\[IMAGE:[\\s\\S]+?\\]\\([^)]+\\)");
    private static final Pattern COLOR_TAG = Pattern.compile(
            "(?i)\\[(?:" + HighlightColor.TAG_ALTERNATION + "):.*?\\]");
    private static final Pattern BROKEN_COLOR_TAG = Pattern.compile(
            "(?i)(\\[(?:" + HighlightColor.TAG_ALTERNATION + "):[^\\]]*?)\\n");
    private static final Pattern BROKEN_BRACE = Pattern.compile("(\\{[^}]*?)\\n");
    private static final Pattern NUMERIC_FRACTION_BEFORE_DIGIT_OR_PAREN = Pattern.compile(
            "\\{(\\d+\\s*/\\s*\\d+)\\}\\s*(?=[\\d(])");
    private static final Pattern FRACTION_TOKEN = Pattern.compile("\\{[^}]*/[^}]*\\}");
    private static final Pattern SUBSCRIPT_TOKEN = Pattern.compile("_[^_]+_");
    private static final Pattern SUPERSCRIPT_TOKEN = Pattern.compile("\\^[^^]+\\^");
    private static final Pattern DOUBLE_SPACE = Pattern.compile("  +");

    private static final Pattern UNDERSCORE_BEFORE_DOT = Pattern.compile("(\\d+)_+\\.");
    private static final Pattern UNDERSCORE_BEFORE_SPACE = Pattern.compile("(\\d+)_+\\s");
    private static final Pattern UNDERSCORE_BEFORE_COMMA = Pattern.compile("(\\d+)_+,");
    private static final Pattern UNDERSCORE_BEFORE_PAREN = Pattern.compile("(\\d+)_+\\)");
    private static final Pattern UNDERSCORE_BEFORE_OPERATOR = Pattern.compile("(\\d+)_+([+\\-*/])");
    private static final Pattern NUMBERED_HEADING_UNDERSCORE = Pattern.compile(
            "(?i)\\b(problem|exercise|question)_+(\\d+)");
    private static final Pattern ORPHAN_DASH_LINE = Pattern.compile("(?m)^\\s*-{1,3}\\s*$");
    private static final Pattern DASH_AFTER_DIVIDER = Pattern.compile("(-{4,})\\s*\\n\\s*-\\s*\\n");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final int iterationCap;

    ContentPipeline(int iterationCap) {
        this.iterationCap = iterationCap;
    }

    /**
     * Runs the full content repair and the structural pass once.
     */
    String formatEquationOnce(String raw) {
        return structuralPass(formatContent(raw));
    }

    /**
     * Full repair of free-form content. Input must already be scrubbed of reserved markers.
     */
    String formatContent(String scrubbed) {
        String result = DelimiterNormalizer.normalizeLineBreaks(scrubbed);
        result = DelimiterNormalizer.removeNewlinesInsideDelimiters(result);

        MaskArena arena = new MaskArena();
        result = arena.maskAll(result, IMAGE_REFERENCE);

        result = NotationDisambiguator.disambiguateAsterisks(result);
        result = FractionNormalizer.normalizeFractionForms(result);
        result = LabelIsolator.isolateLabels(result);
        result = arena.maskAll(result, LabelIsolator.ISOLATED_LABEL_BLOCK);
        result = ListStepSegmenter.insertStepBreaks(result);
        result = ListStepSegmenter.insertListBreaks(result);

        result = LatexNotationStripper.stripLatex(result);
        result = FractionNormalizer.repairMalformedBraces(result);
        result = ScriptNotationRepairer.convertUnicodeScripts(result);
        result = FractionNormalizer.convertRawFractions(result);
        result = ScriptNotationRepairer.closeUnclosedScripts(result);
        result = RedundantAnswerCollapser.collapse(result);

        result = joinInside(result, BROKEN_COLOR_TAG, "$1 ", "color tag");
        result = joinInside(result, BROKEN_BRACE, "$1", "brace");
        result = NUMERIC_FRACTION_BEFORE_DIGIT_OR_PAREN.matcher(result).replaceAll("{$1} × ");

        result = arena.maskAll(result, COLOR_TAG);
        result = arena.maskAll(result, FRACTION_TOKEN);
        result = arena.maskAll(result, SUBSCRIPT_TOKEN);
        result = arena.maskAll(result, SUPERSCRIPT_TOKEN);
        result = ListStepSegmenter.protectParagraphs(result);
        result = LineBreakRepairer.repairLineBreaks(result);
        result = DOUBLE_SPACE.matcher(result).replaceAll(" ");
        result = arena.restore(result);

        result = ListStepSegmenter.resolveBreaks(result);
        return removeStrayArtifacts(result);
    }

    /**
     * Keeps an equation block well formed: tidy fractions, no breaks inside delimiters, wrapped
     * lines rejoined, at most one blank line in a row.
     */
    String structuralPass(String text) {
        String result = FractionNormalizer.normalizeFractionWhitespace(text);
        result = FractionNormalizer.normalizeFractionMultiplication(result);
        result = DelimiterNormalizer.removeNewlinesInsideDelimiters(result);
        result = LineJoiner.joinBrokenEquationLines(result);
        result = FractionNormalizer.normalizeAdjacentFractions(result);
        result = EXCESS_BLANK_LINES.matcher(result).replaceAll("\n\n");
        return result.trim();
    }

    private String joinInside(String text, Pattern brokenRegion, String replacement, String regionName) {
        return BoundedRewrite.untilStable(
                text, current -> brokenRegion.matcher(current).replaceAll(replacement), iterationCap,
                "line break joining inside " + regionName + " regions").text();
    }

    private static String removeStrayArtifacts(String text) {
        String result = UNDERSCORE_BEFORE_DOT.matcher(text).replaceAll("$1.");
        result = UNDERSCORE_BEFORE_SPACE.matcher(result).replaceAll("$1 ");
        result = UNDERSCORE_BEFORE_COMMA.matcher(result).replaceAll("$1,");
        result = UNDERSCORE_BEFORE_PAREN.matcher(result).replaceAll("$1)");
        result = UNDERSCORE_BEFORE_OPERATOR.matcher(result).replaceAll("$1 $2");
        result = NUMBERED_HEADING_UNDERSCORE.matcher(result).replaceAll("$1 $2");
        result = ORPHAN_DASH_LINE.matcher(result).replaceAll("");
        return DASH_AFTER_DIVIDER.matcher(result).replaceAll("$1\n\n");
    }
}
