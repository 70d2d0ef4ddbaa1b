package com.williamcallahan.mathtext.service.formatting;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejoins equation lines that were wrapped mid-expression, one paragraph at a time.
 */
public final class LineJoiner {
    private static final Pattern PARAGRAPH_SEPARATOR = Pattern.compile("\\n\\s*\\n");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern TRAILING_OPERATOR = Pattern.compile("[+\\-*/=]$");
    private static final Pattern TRAILING_OPENER = Pattern.compile("[(\\[{]$");
    private static final Pattern LEADING_CLOSER = Pattern.compile("^[)\\]}]");
    private static final Pattern LEADING_OPERATOR = Pattern.compile("^[+*/=]");
    private static final Pattern LEADING_MINUS_OPERATOR = Pattern.compile("^-[^0-9]");
    private static final Pattern EQUATION_START = Pattern.compile("^[0-9a-zA-Z*_]");
    private static final int MIN_LEFT_SIDE_LENGTH = 3;

    private LineJoiner() {}

    /**
     * Joins a line with the next while the line is incomplete or the next line continues it.
     *
     * <p>Paragraphs never merge, label lines never join with anything, and a line that starts a
     * new equation always stays on its own.</p>
     */
    public static String joinBrokenEquationLines(String text) {
        List<String> processedParagraphs = new ArrayList<>();
        for (String paragraph : PARAGRAPH_SEPARATOR.split(text, -1)) {
            List<String> lines = new ArrayList<>();
            for (String rawLine : paragraph.split("\n")) {
                String trimmed = rawLine.trim();
                if (!trimmed.isEmpty()) {
                    lines.add(trimmed);
                }
            }
            processedParagraphs.add(String.join("\n", joinLines(lines)));
        }
        return String.join("\n\n", processedParagraphs);
    }

    private static List<String> joinLines(List<String> lines) {
        List<String> joined = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            String currentLine = lines.get(index);
            if (LabelIsolator.isLabelLine(currentLine)) {
                joined.add(currentLine);
                continue;
            }
            while (index + 1 < lines.size()) {
                String nextLine = lines.get(index + 1);
                if (LabelIsolator.isLabelLine(nextLine) || startsNewEquation(nextLine)) {
                    break;
                }
                if (!isIncompleteLine(currentLine) && !startsWithContinuation(nextLine)) {
                    break;
                }
                currentLine = WHITESPACE_RUN.matcher(currentLine + " " + nextLine).replaceAll(" ").trim();
                index++;
            }
            joined.add(currentLine);
        }
        return joined;
    }

    static boolean isIncompleteLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        return DelimiterNormalizer.hasUnbalancedDelimiters(trimmed)
                || TRAILING_OPERATOR.matcher(trimmed).find()
                || TRAILING_OPENER.matcher(trimmed).find()
                || trimmed.endsWith(",");
    }

    static boolean startsWithContinuation(String line) {
        String trimmed = line.trim();
        return LEADING_CLOSER.matcher(trimmed).find()
                || LEADING_OPERATOR.matcher(trimmed).find()
                || LEADING_MINUS_OPERATOR.matcher(trimmed).find();
    }

    static boolean startsNewEquation(String line) {
        String trimmed = line.trim();
        if (!EQUATION_START.matcher(trimmed).find()) {
            return false;
        }
        int equalsIndex = trimmed.indexOf('=');
        return equalsIndex >= MIN_LEFT_SIDE_LENGTH;
    }
}
