package com.williamcallahan.mathtext.service.formatting;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes answers that are written out once before a red answer tag and again inside it.
 */
final class RedundantAnswerCollapser {
    private static final Pattern ORPHANED_FOR = Pattern.compile("\\bfor\\s*:\\s*([*a-zA-Z])");
    private static final Pattern VALUE_THEN_RED_ANSWER = Pattern.compile(
            "([^=\\n]+)=\\s*([^→\\n]+?)\\s*→\\s*\\[red:([^\\]]+)\\]");
    private static final Pattern EXPRESSION_THEN_RED_ANSWER = Pattern.compile(
            "([*a-zA-Z0-9\\s=+\\-×÷{}/.()]+)\\s*→\\s*\\[red:([^\\]]+)\\]");
    private static final Pattern COLON_THEN_RED_ANSWER = Pattern.compile("([^:\\n→]{10,}):\\s*\\[red:([^\\]]+)\\]");
    private static final Pattern COMPARISON_NOISE = Pattern.compile("[\\s*{}]");
    private static final Pattern UNIT_NOISE = Pattern.compile("cm[²³]?|pi");

    private RedundantAnswerCollapser() {}

    static String collapse(String text) {
        String result = ORPHANED_FOR.matcher(text).replaceAll("$1");
        if (!result.contains("[red:")) {
            return result;
        }
        result = collapseValueBeforeArrow(result);
        result = collapseExpressionBeforeArrow(result);
        return collapseTextBeforeColon(result);
    }

    private static String collapseValueBeforeArrow(String text) {
        Matcher matcher = VALUE_THEN_RED_ANSWER.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String expression = matcher.group(1);
            String before = comparable(matcher.group(2)).toLowerCase(Locale.ROOT);
            String answer = matcher.group(3);
            String inside = comparable(answer).toLowerCase(Locale.ROOT);
            boolean redundant = overlaps(before, inside)
                    || UNIT_NOISE.matcher(before).replaceAll("").equals(UNIT_NOISE.matcher(inside).replaceAll(""));
            String replacement = redundant ? expression.trim() + " → [red:" + answer + "]" : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String collapseExpressionBeforeArrow(String text) {
        Matcher matcher = EXPRESSION_THEN_RED_ANSWER.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String answer = matcher.group(2);
            boolean redundant = overlaps(comparable(matcher.group(1)), comparable(answer));
            String replacement = redundant ? "→ [red:" + answer + "]" : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String collapseTextBeforeColon(String text) {
        Matcher matcher = COLON_THEN_RED_ANSWER.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String answer = matcher.group(2);
            boolean redundant = overlaps(comparable(matcher.group(1)), comparable(answer));
            String replacement = redundant ? "→ [red:" + answer + "]" : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String comparable(String fragment) {
        return COMPARISON_NOISE.matcher(fragment.trim()).replaceAll("");
    }

    // An empty side would contain everything, so it never counts as a repeat.
    private static boolean overlaps(String before, String inside) {
        if (before.isEmpty() || inside.isEmpty()) {
            return false;
        }
        return before.contains(inside) || inside.contains(before);
    }
}
