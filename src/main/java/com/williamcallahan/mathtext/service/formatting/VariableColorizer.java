package com.williamcallahan.mathtext.service.formatting;

import com.williamcallahan.mathtext.domain.formatting.HighlightColor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gives every single-letter italic variable one consistent color across a solution.
 */
public final class VariableColorizer {
    /** Colors handed out to variables, in assignment order. */
    public static final List<HighlightColor> PALETTE = List.of(
            HighlightColor.BLUE, HighlightColor.GREEN, HighlightColor.ORANGE, HighlightColor.PURPLE);

    private static final Set<String> SKIPPED_LETTERS = Set.of("a", "i");
    private static final Pattern SINGLE_LETTER_ITALIC = Pattern.compile("\\*([a-zA-Z])\\*");
    private static final Pattern COLOR_TAG = Pattern.compile(
            "(?i)\\[(?:" + HighlightColor.TAG_ALTERNATION + "):[^\\]]*\\]");

    private VariableColorizer() {}

    /**
     * Lists the distinct single-letter italic variables in first-seen order, skipping "a" and "i".
     */
    public static List<String> extractSingleLetterVariables(String text) {
        Set<String> variables = new LinkedHashSet<>();
        Matcher matcher = SINGLE_LETTER_ITALIC.matcher(text);
        while (matcher.find()) {
            String letter = matcher.group(1);
            if (!SKIPPED_LETTERS.contains(letter)) {
                variables.add(letter);
            }
        }
        return new ArrayList<>(variables);
    }

    /**
     * Assigns palette colors to the variables of the given text, cycling when there are more
     * variables than colors.
     */
    public static Map<String, HighlightColor> buildColorMap(String text) {
        Map<String, HighlightColor> colorMap = new LinkedHashMap<>();
        List<String> variables = extractSingleLetterVariables(text);
        for (int index = 0; index < variables.size(); index++) {
            colorMap.put(variables.get(index), PALETTE.get(index % PALETTE.size()));
        }
        return colorMap;
    }

    /**
     * Wraps mapped {@code *x*} variables in color tags. Variables already inside a color tag keep
     * their existing color.
     */
    public static String applyColors(String text, Map<String, HighlightColor> colorMap) {
        if (colorMap.isEmpty() || text.indexOf('*') < 0) {
            return text;
        }
        MaskArena arena = new MaskArena();
        String masked = arena.maskAll(text, COLOR_TAG);
        Matcher matcher = SINGLE_LETTER_ITALIC.matcher(masked);
        StringBuilder colored = new StringBuilder(masked.length() + 16);
        while (matcher.find()) {
            HighlightColor color = colorMap.get(matcher.group(1));
            String replacement = color == null
                    ? matcher.group()
                    : "[" + color.token() + ":" + matcher.group() + "]";
            matcher.appendReplacement(colored, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(colored);
        return arena.restore(colored.toString());
    }
}
