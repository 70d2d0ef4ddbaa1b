package com.williamcallahan.mathtext.service.equation;

import com.williamcallahan.mathtext.domain.equation.BothSidesOperation;
import com.williamcallahan.mathtext.domain.equation.StepAction;
import com.williamcallahan.mathtext.domain.equation.StepActionClassification;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword classifier that labels what a solution step does from its title or summary.
 *
 * <p>Rules are checked in order and the first match wins, so a sentence that both concludes and
 * simplifies is reported as the final answer.</p>
 */
public final class StepActionClassifier {
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?]+$");

    private static final List<OperationRule> OPERATION_RULES = List.of(
        new OperationRule(BothSidesOperation.Type.ADD,
            Pattern.compile("\\b(?:add|adding)\\s+(.+?)\\s+to\\s+(?:both|each)\\s+sides?\\b", Pattern.CASE_INSENSITIVE)),
        new OperationRule(BothSidesOperation.Type.SUBTRACT,
            Pattern.compile("\\b(?:subtract|subtracting)\\s+(.+?)\\s+from\\s+(?:both|each)\\s+sides?\\b",
                Pattern.CASE_INSENSITIVE)),
        new OperationRule(BothSidesOperation.Type.MULTIPLY,
            Pattern.compile("\\b(?:multiply|multiplying)\\s+(?:both|each)\\s+sides?\\s+by\\s+(\\S+)", Pattern.CASE_INSENSITIVE)),
        new OperationRule(BothSidesOperation.Type.DIVIDE,
            Pattern.compile("\\b(?:divide|dividing)\\s+(?:both|each)\\s+sides?\\s+by\\s+(\\S+)", Pattern.CASE_INSENSITIVE))
    );

    private static final List<ActionRule> ACTION_RULES = List.of(
        new ActionRule(StepAction.FINAL, Pattern.compile(
            "^\\s*(?:therefore|thus|hence|so)\\b|\\bfinal answer\\b|\\bthe answer is\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.ADD_SUBTRACT_BOTH_SIDES, Pattern.compile(
            "\\b(?:add|adding|subtract|subtracting)\\b.*\\b(?:both|each)\\s+sides?\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.MULTIPLY_DIVIDE_BOTH_SIDES, Pattern.compile(
            "\\b(?:multiply|multiplying|divide|dividing)\\b.*\\b(?:both|each)\\s+sides?\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.DISTRIBUTE, Pattern.compile(
            "\\b(?:distribut\\w*|expand\\w*)\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.COMBINE_LIKE_TERMS, Pattern.compile(
            "\\b(?:combin\\w*|like terms)\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.FACTOR, Pattern.compile("\\bfactor\\w*\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.SUBSTITUTE, Pattern.compile(
            "\\b(?:substitut\\w*|plug\\w*\\s+in)\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.ISOLATE_VARIABLE, Pattern.compile(
            "\\b(?:isolat\\w*|solve for)\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.CHECK, Pattern.compile("\\b(?:check\\w*|verif\\w*)\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.EVALUATE, Pattern.compile(
            "\\b(?:evaluat\\w*|calculat\\w*|comput\\w*)\\b", Pattern.CASE_INSENSITIVE)),
        new ActionRule(StepAction.SIMPLIFY, Pattern.compile(
            "\\b(?:simplif\\w*|reduc\\w*)\\b", Pattern.CASE_INSENSITIVE))
    );

    private StepActionClassifier() {}

    /**
     * Classifies a step's wording, attaching the parsed both-sides operation when there is one.
     */
    public static StepActionClassification classify(String text) {
        if (text == null || text.isBlank()) {
            return StepActionClassification.of(StepAction.REWRITE);
        }
        for (ActionRule rule : ACTION_RULES) {
            if (rule.pattern().matcher(text).find()) {
                BothSidesOperation operation = isBothSides(rule.action())
                    ? extractBothSidesOperation(text).orElse(null)
                    : null;
                return new StepActionClassification(rule.action(), operation);
            }
        }
        return StepActionClassification.of(StepAction.REWRITE);
    }

    /**
     * Parses phrases like "Add 11 to both sides" or "Divide each side by {1/2}".
     */
    public static Optional<BothSidesOperation> extractBothSidesOperation(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (OperationRule rule : OPERATION_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.find()) {
                String operand = TRAILING_PUNCTUATION.matcher(matcher.group(1).trim()).replaceAll("");
                if (!operand.isBlank()) {
                    return Optional.of(new BothSidesOperation(rule.type(), operand));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isBothSides(StepAction action) {
        return action == StepAction.ADD_SUBTRACT_BOTH_SIDES || action == StepAction.MULTIPLY_DIVIDE_BOTH_SIDES;
    }

    private record OperationRule(BothSidesOperation.Type type, Pattern pattern) {
    }

    private record ActionRule(StepAction action, Pattern pattern) {
    }
}
