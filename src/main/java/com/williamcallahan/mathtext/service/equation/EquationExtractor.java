package com.williamcallahan.mathtext.service.equation;

import com.williamcallahan.mathtext.domain.equation.Equation;
import com.williamcallahan.mathtext.domain.equation.EquationExtraction;
import com.williamcallahan.mathtext.domain.formatting.HighlightColor;
import com.williamcallahan.mathtext.service.formatting.LabelIsolator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls validated equations out of a canonical multi-line step block.
 *
 * <p>Each line is cleaned of labels, color tags and image references, split on arrows into
 * independent transformation segments, and every top-level {@code left = right} pair in a
 * segment is validated. Rejected candidates are dropped silently. Lines that yield nothing and
 * are not explanatory noise come back as plain content rows.</p>
 */
public final class EquationExtractor {
    private static final Pattern PROCESSED_IMAGE = Pattern.compile("\\[IMAGE:[^\\]]*\\]\\([^)]+\\)");
    private static final String PENDING_IMAGE = "[IMAGE NEEDED:";
    private static final Pattern COLOR_TAG = Pattern.compile(
        "\\[(?:" + HighlightColor.TAG_ALTERNATION + "):([^\\]]*)\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern RED_TAG = Pattern.compile("\\[red:([^\\]]+)\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARROW_SPLIT = Pattern.compile("->|=>|→|⟶|⇒|⟹|➔|➝|➞|➟");
    private static final Pattern TRAILING_ARROW = Pattern.compile("(?:->|=>|→|⟶|⇒|⟹|➔|➝|➞|➟)\\s*$");
    private static final Pattern PROSE_OPENER = Pattern.compile(
        "^(?:where|since|because|note|this|we|the|let)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MATH_LIKE = Pattern.compile("[\\d{}*xy]");
    private static final Pattern REPEATED_EQUATION = Pattern.compile("^(.+?=.+?)\\s+\\1$");
    private static final Pattern RIGHT_LEADING_OPERATOR = Pattern.compile("^[+*/×÷=^·]");
    private static final Pattern TRAILING_OPERATOR = Pattern.compile("[+\\-/=×÷^·]$");
    private static final Pattern HAS_ALPHANUMERIC = Pattern.compile("[\\dA-Za-z]");
    private static final Pattern SINGLE_LETTER = Pattern.compile("[A-Za-z]");
    private static final Pattern UNSIMPLIFIED_PRODUCT = Pattern.compile("×\\s*\\{[^}]+\\}\\s*[A-Za-z]$");
    private static final Pattern FRACTION_TERM = Pattern.compile("\\{[^}]+\\}\\s*[A-Za-z]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private EquationExtractor() {}

    /**
     * Extracts unique equations, in first-seen order, plus the content rows of a block.
     *
     * @param canonical canonical equation-mode text, possibly multi-line
     */
    public static EquationExtraction extract(String canonical) {
        if (canonical == null || canonical.isBlank()) {
            return EquationExtraction.empty();
        }
        Map<String, Equation> unique = new LinkedHashMap<>();
        List<String> contentRows = new ArrayList<>();
        for (String rawLine : canonical.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            LineOutcome outcome = extractFromLine(line);
            for (Equation equation : outcome.equations()) {
                unique.putIfAbsent(equation.dedupKey(), equation);
            }
            if (outcome.equations().isEmpty() && !outcome.noise()) {
                contentRows.add(line);
            }
        }
        return new EquationExtraction(new ArrayList<>(unique.values()), contentRows);
    }

    public static List<Equation> extractAll(String canonical) {
        return extract(canonical).equations();
    }

    /**
     * Picks the equation that best represents the result of a step.
     *
     * <p>A {@code [red:...]} answer wins: it is used whole when it is itself an equation, and is
     * otherwise paired with the expression that precedes it on its line. Without a red answer the
     * last extracted equation is used.</p>
     */
    public static Optional<Equation> extractFinalEquation(String canonical) {
        if (canonical == null || canonical.isBlank()) {
            return Optional.empty();
        }
        for (String rawLine : canonical.split("\n")) {
            Matcher red = RED_TAG.matcher(rawLine);
            if (!red.find()) {
                continue;
            }
            String answer = red.group(1).trim();
            if (answer.contains("=")) {
                Optional<Equation> whole = validate(answer);
                if (whole.isPresent()) {
                    return whole;
                }
                continue;
            }
            Optional<Equation> paired = pairWithPrecedingExpression(rawLine.substring(0, red.start()), answer);
            if (paired.isPresent()) {
                return paired;
            }
        }
        return extract(canonical).lastEquation();
    }

    /**
     * Splits at the first top-level {@code =} that is not part of a comparison operator.
     */
    public static Optional<Equation> splitEquation(String text) {
        if (text == null) {
            return Optional.empty();
        }
        List<Integer> positions = topLevelEqualsPositions(text);
        if (positions.isEmpty()) {
            return Optional.empty();
        }
        int split = positions.get(0);
        String left = text.substring(0, split).trim();
        String right = text.substring(split + 1).trim();
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Equation.of(left, right));
    }

    /**
     * Validates a single candidate that must contain exactly one top-level {@code =}.
     *
     * @return the normalized equation, or empty when the candidate is rejected
     */
    public static Optional<Equation> validate(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String trimmed = candidate.trim();
        List<Integer> positions = topLevelEqualsPositions(trimmed);
        if (positions.size() != 1) {
            return Optional.empty();
        }
        int split = positions.get(0);
        String left = trimmed.substring(0, split).trim();
        String right = trimmed.substring(split + 1).trim();
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        if (RIGHT_LEADING_OPERATOR.matcher(right).find() || TRAILING_OPERATOR.matcher(right).find()) {
            return Optional.empty();
        }
        if (countAsterisks(trimmed) % 2 != 0 || !HAS_ALPHANUMERIC.matcher(right).find()) {
            return Optional.empty();
        }
        if (hasRepeatedSingleLetter(trimmed) || UNSIMPLIFIED_PRODUCT.matcher(right).find()) {
            return Optional.empty();
        }
        if (repeatsLeftFractionTerm(left, right)) {
            return Optional.empty();
        }
        return Optional.of(Equation.of(left, right));
    }

    private static LineOutcome extractFromLine(String line) {
        String working = afterImageReference(line);
        if (working.isEmpty()) {
            return LineOutcome.NOISE;
        }
        working = LabelIsolator.stripLeadingLabel(working).trim();
        working = COLOR_TAG.matcher(working).replaceAll("$1").trim();
        working = instructionTail(working);
        if (working.isEmpty()) {
            return LineOutcome.NOISE;
        }
        if (isNoise(working)) {
            return LineOutcome.NOISE;
        }
        if (!working.contains("=") || !MATH_LIKE.matcher(working).find()) {
            return LineOutcome.CONTENT;
        }
        List<Equation> equations = new ArrayList<>();
        for (String segment : ARROW_SPLIT.split(working)) {
            String collapsed = collapseRepeatedEquation(segment.trim());
            equations.addAll(candidatesInSegment(collapsed));
        }
        return new LineOutcome(equations, false);
    }

    private static List<Equation> candidatesInSegment(String segment) {
        List<Integer> positions = topLevelEqualsPositions(segment);
        if (positions.isEmpty()) {
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        int termStart = 0;
        for (int position : positions) {
            terms.add(segment.substring(termStart, position).trim());
            termStart = position + 1;
        }
        terms.add(segment.substring(termStart).trim());

        List<Equation> equations = new ArrayList<>();
        for (int index = 0; index + 1 < terms.size(); index++) {
            validate(terms.get(index) + " = " + terms.get(index + 1)).ifPresent(equations::add);
        }
        return equations;
    }

    private static String afterImageReference(String line) {
        Matcher image = PROCESSED_IMAGE.matcher(line);
        int end = -1;
        while (image.find()) {
            end = image.end();
        }
        if (end >= 0) {
            return line.substring(end).trim();
        }
        if (line.contains(PENDING_IMAGE)) {
            int closing = line.lastIndexOf(']');
            return closing < 0 ? "" : line.substring(closing + 1).trim();
        }
        return line;
    }

    /**
     * For "Subtract 5 from both sides: x = 5" keeps only the equation after the colon.
     */
    private static String instructionTail(String line) {
        int colon = line.lastIndexOf(':');
        if (colon < 0 || colon == line.length() - 1) {
            return line;
        }
        String head = line.substring(0, colon);
        String tail = line.substring(colon + 1).trim();
        if (!head.contains("=") && tail.contains("=")) {
            return tail;
        }
        return line;
    }

    private static boolean isNoise(String line) {
        return line.endsWith(":") || PROSE_OPENER.matcher(line).find();
    }

    private static String collapseRepeatedEquation(String segment) {
        Matcher repeated = REPEATED_EQUATION.matcher(segment);
        return repeated.matches() ? repeated.group(1).trim() : segment;
    }

    private static Optional<Equation> pairWithPrecedingExpression(String beforeAnswer, String answer) {
        String before = TRAILING_ARROW.matcher(beforeAnswer.trim()).replaceAll("").trim();
        Matcher arrow = ARROW_SPLIT.matcher(before);
        int cut = 0;
        while (arrow.find()) {
            cut = arrow.end();
        }
        String variablePart = LabelIsolator.stripLeadingLabel(before.substring(cut).trim());
        int lastEquals = variablePart.lastIndexOf('=');
        if (lastEquals >= 0) {
            variablePart = variablePart.substring(0, lastEquals);
            variablePart = variablePart.substring(variablePart.lastIndexOf('=') + 1);
        }
        variablePart = COLOR_TAG.matcher(variablePart).replaceAll("$1").trim();
        if (variablePart.isEmpty()) {
            return Optional.empty();
        }
        return validate(variablePart + " = " + answer);
    }

    private static List<Integer> topLevelEqualsPositions(String text) {
        List<Integer> positions = new ArrayList<>();
        int depth = 0;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current == '(' || current == '{' || current == '[') {
                depth++;
            } else if ((current == ')' || current == '}' || current == ']') && depth > 0) {
                depth--;
            } else if (current == '=' && depth == 0 && isAssignmentEquals(text, index)) {
                positions.add(index);
            }
        }
        return positions;
    }

    private static boolean isAssignmentEquals(String text, int index) {
        char before = index > 0 ? text.charAt(index - 1) : ' ';
        char after = index + 1 < text.length() ? text.charAt(index + 1) : ' ';
        if (before == '=' || before == '!' || before == '<' || before == '>') {
            return false;
        }
        return after != '=' && after != '>';
    }

    private static int countAsterisks(String text) {
        int count = 0;
        for (int index = 0; index < text.length(); index++) {
            if (text.charAt(index) == '*') {
                count++;
            }
        }
        return count;
    }

    private static boolean hasRepeatedSingleLetter(String text) {
        String[] tokens = WHITESPACE.split(text.replace("*", "").trim());
        for (int index = 1; index < tokens.length; index++) {
            String token = tokens[index];
            if (SINGLE_LETTER.matcher(token).matches() && token.equals(tokens[index - 1])) {
                return true;
            }
        }
        return false;
    }

    private static boolean repeatsLeftFractionTerm(String left, String right) {
        String compactLeft = WHITESPACE.matcher(left).replaceAll("").toLowerCase(Locale.ROOT);
        Matcher term = FRACTION_TERM.matcher(right);
        while (term.find()) {
            String compactTerm = WHITESPACE.matcher(term.group()).replaceAll("").toLowerCase(Locale.ROOT);
            if (compactLeft.contains(compactTerm)) {
                return true;
            }
        }
        return false;
    }

    private record LineOutcome(List<Equation> equations, boolean noise) {
        static final LineOutcome NOISE = new LineOutcome(List.of(), true);
        static final LineOutcome CONTENT = new LineOutcome(List.of(), false);
    }
}
