package com.williamcallahan.mathtext.service.formatting;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes line breaks that split an atomic unit such as a decimal, a number and its unit, or an
 * expression around an operator. Breaks that separate steps or aligned equations are kept.
 *
 * <p>Runs on masked text, so color tags, fractions and scripts are opaque keys here.</p>
 */
final class LineBreakRepairer {

    private record Repair(Pattern pattern, String replacement) {
        String apply(String text) {
            return pattern.matcher(text).replaceAll(replacement);
        }
    }

    private static Repair repair(String regex, String replacement) {
        return new Repair(Pattern.compile(regex), replacement);
    }

    private static Repair repairIgnoringCase(String regex, String replacement) {
        return new Repair(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    private static final List<Repair> ATOMIC_UNIT_REPAIRS = List.of(
            repair("(\\d+)\\s*\\n\\s*(\\.\\d+)", "$1$2"),
            repair("(\\d+\\.?\\d*)\\s*\\n\\s*([a-zA-Z]++)(?!\\s*=)", "$1 $2"),
            repair("\\((\\d+\\.?\\d*),?\\s*\\n\\s*(\\d+\\.?\\d*)\\)", "($1, $2)"),
            repair("\\(\\s*(\\d+\\.?\\d*)\\s*\\n\\s*,\\s*(\\d+\\.?\\d*)\\s*\\)", "($1, $2)"),
            repairIgnoringCase("(slope)\\s*(:|=)\\s*(-?)\\s*\\n\\s*", "$1 $2 $3"),
            repairIgnoringCase("(y-intercept|x-intercept|slope)\\s*(:|=)\\s*\\n\\s*", "$1 $2 "),
            repairIgnoringCase("and\\s*\\n\\s*(y-intercept|x-intercept)", "and $1"));

    private static final Pattern SLOPE_INTERCEPT_LIST = Pattern.compile(
            "(slope)\\s*(:|=)\\s*[^,\\n]+,\\s*\\n\\s*(y-intercept|x-intercept)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BREAK_WITH_INDENT = Pattern.compile("\\n\\s*");

    private static final List<Repair> EXPRESSION_REPAIRS = List.of(
            repair("(\\d+\\.?\\d*)\\s*\\n\\s*(/)\\s*\\n\\s*(\\d+\\.?\\d*)", "$1$2$3"),
            repair("(\\d+\\.?\\d*)\\s*\\n\\s*(/)\\s*(\\d+\\.?\\d*)", "$1$2$3"),
            repair("(\\d+\\.?\\d*)\\s*\\n\\s*×\\s*\\n\\s*(\\d+\\.?\\d*)", "$1 × $2"),
            repair("×\\s*\\n\\s*", "× "),
            repair("\\s*\\n\\s*×", " ×"),
            repair("(\\))\\s*\\n\\s*(\\+|-)\\s*", "$1 $2 "),
            repairIgnoringCase("(\\d+|\\*[a-z]+\\*)\\s*\\n\\s*(\\+|-)\\s+", "$1 $2 "),
            repairIgnoringCase("(Solving for|hence|therefore|thus)\\s*\\n\\s*([a-z])", "$1 $2"),
            repair("\\b(The|A|An|This|That|These|Those|It|We|They)\\s*\\n\\s*", "$1 "),
            repairIgnoringCase("\\bfor\\s*\\n\\s*(\\d+)", "for $1"),
            repair("√\\s*\\n\\s*\\(", "√("),
            repair("(\\})\\s*\\n\\s*(\\()", "$1$2"),
            repairIgnoringCase("(when\\s+[^\\n]+)\\s*\\n\\s*(\\([^)]+)", "$1 $2"),
            repair("\\s*\\n\\s*([.,;)])", "$1"),
            repair("([^\\s])\\s*\\n\\s*,\\s*", "$1, "),
            repair("([^\\s])\\s*\\n\\s*=", "$1 ="),
            repair("=\\s*\\n(?!\\s{3,})", "= "),
            repairIgnoringCase(":\\s*\\n\\s*(and|or|so|which|where|that|because)\\s+", ": $1 "));

    private LineBreakRepairer() {}

    static String repairLineBreaks(String text) {
        if (text.indexOf('\n') < 0) {
            return text;
        }
        String result = text;
        for (Repair repair : ATOMIC_UNIT_REPAIRS) {
            result = repair.apply(result);
        }
        result = joinSlopeInterceptLists(result);
        for (Repair repair : EXPRESSION_REPAIRS) {
            result = repair.apply(result);
        }
        return result;
    }

    private static String joinSlopeInterceptLists(String text) {
        Matcher matcher = SLOPE_INTERCEPT_LIST.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String joined = BREAK_WITH_INDENT.matcher(matcher.group()).replaceAll(" ");
            matcher.appendReplacement(result, Matcher.quoteReplacement(joined));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
