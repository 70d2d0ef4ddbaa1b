package com.williamcallahan.mathtext.service.formatting;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits run-on content into paragraphs at step instructions and list items.
 *
 * <p>Breaks are first written as a private-use sentinel so that the line-break repairs which run
 * afterwards cannot undo them; {@link #resolveBreaks(String)} turns them into blank lines at the
 * end of the pipeline.</p>
 */
final class ListStepSegmenter {
    static final String PARAGRAPH_BREAK = MaskArena.KEY_OPEN + "P" + MaskArena.KEY_CLOSE;

    static final List<String> STEP_KEYWORDS = List.of(
            "Start with the equation", "Starting with the equation", "Start with", "Starting with",
            "Original equation", "Add", "Subtract", "Multiply", "Divide", "Simplify", "Combine",
            "Factor", "Expand", "Distribute", "Solve", "Rearrange", "Isolate", "Cross-multiply",
            "Cross multiply", "Graph", "Rewrite", "Convert", "Transform");

    private static final String KEYWORD_ALTERNATION = STEP_KEYWORDS.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    private static final Pattern STEP_BOUNDARY = Pattern.compile(
            "(.)\\s+(" + KEYWORD_ALTERNATION + ")\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNDERSCORE_BEFORE_KEYWORD = Pattern.compile(
            "_\\s*(" + KEYWORD_ALTERNATION + ")");

    private static final Pattern BLANK_LINE = Pattern.compile("[ \\t]*\\n[ \\t]*\\n\\s*");

    private static final Pattern LETTER_MARKER_UNDERSCORE_DOT = Pattern.compile("([A-D])_+\\.");
    private static final Pattern LETTER_MARKER_UNDERSCORE_PAREN = Pattern.compile("([A-D])_+\\)");
    private static final Pattern LETTER_MARKER_DOT_GLUED = Pattern.compile("([A-D])\\.([A-Z])");
    private static final Pattern LETTER_MARKER_PAREN_GLUED = Pattern.compile("([A-D])\\)([A-Z])");
    private static final int MIN_LINE_CONTEXT = 20;
    private static final List<Pattern> LIST_MARKER_FAMILIES = List.of(
            Pattern.compile("(?<=[\\s.!?:;,])[ \\t]*(\\([a-dA-D]\\))[ \\t]+"),
            Pattern.compile("[ \\t]+([A-D]\\.)[ \\t]+"),
            Pattern.compile("[ \\t]+([A-D]\\))[ \\t]+"),
            Pattern.compile("[ \\t]+(\\d{1,2}\\.)[ \\t]+(?=\\D)"),
            Pattern.compile("[ \\t]+(\\d{1,2}\\))[ \\t]+"));

    private ListStepSegmenter() {}

    /**
     * Marks a paragraph break before every step instruction keyword that follows other content.
     * Keywords match in any case, but a lowercase keyword right after a word is part of a
     * sentence and stays in place.
     */
    static String insertStepBreaks(String text) {
        return STEP_BOUNDARY.matcher(text).replaceAll(match -> {
            boolean inSentence = Character.isLowerCase(match.group(2).charAt(0))
                    && Character.isLetter(match.group(1).charAt(0));
            String replacement = inSentence ? match.group() : match.group(1) + PARAGRAPH_BREAK + match.group(2);
            return Matcher.quoteReplacement(replacement);
        });
    }

    /**
     * Marks every existing blank line as a paragraph break so later line repairs cannot join
     * across it.
     */
    static String protectParagraphs(String text) {
        return BLANK_LINE.matcher(text).replaceAll(PARAGRAPH_BREAK);
    }

    /**
     * Marks a paragraph break before run-on list items such as "A." to "D.", "(a)" to "(d)" and
     * numbered items.
     *
     * <p>The first marker of a kind on a line stays with the text before it, so a question keeps
     * its first option. Every later marker of the same kind on that line starts a new paragraph
     * once at least twenty characters of the line precede it. Lines are never rescanned, so a
     * second run leaves the output unchanged.</p>
     */
    static String insertListBreaks(String text) {
        String result = LETTER_MARKER_UNDERSCORE_DOT.matcher(text).replaceAll("$1.");
        result = LETTER_MARKER_UNDERSCORE_PAREN.matcher(result).replaceAll("$1)");
        result = LETTER_MARKER_DOT_GLUED.matcher(result).replaceAll("$1. $2");
        result = LETTER_MARKER_PAREN_GLUED.matcher(result).replaceAll("$1) $2");
        for (Pattern family : LIST_MARKER_FAMILIES) {
            result = breakRepeatedMarkers(result, family);
        }
        return result;
    }

    private static String breakRepeatedMarkers(String text, Pattern family) {
        Matcher matcher = family.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        int markedLineStart = -1;
        while (matcher.find()) {
            int lineStart = lineStartBefore(text, matcher.start());
            boolean repeatOnLine = markedLineStart == lineStart;
            markedLineStart = lineStart;
            String replacement = repeatOnLine && matcher.start() - lineStart >= MIN_LINE_CONTEXT
                    ? PARAGRAPH_BREAK + matcher.group(1) + " "
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static int lineStartBefore(String text, int position) {
        int newline = text.lastIndexOf('\n', position - 1);
        int paragraphBreak = text.lastIndexOf(PARAGRAPH_BREAK, position - 1);
        int breakEnd = paragraphBreak < 0 ? -1 : paragraphBreak + PARAGRAPH_BREAK.length() - 1;
        return Math.max(newline, breakEnd) + 1;
    }

    /**
     * Replaces break sentinels with blank lines and drops stray underscores left before keywords.
     */
    static String resolveBreaks(String text) {
        String result = text.replace(PARAGRAPH_BREAK, "\n\n");
        return UNDERSCORE_BEFORE_KEYWORD.matcher(result).replaceAll(" $1");
    }
}
