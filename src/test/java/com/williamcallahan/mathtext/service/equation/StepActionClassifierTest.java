package com.williamcallahan.mathtext.service.equation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.mathtext.domain.equation.BothSidesOperation;
import com.williamcallahan.mathtext.domain.equation.StepAction;
import com.williamcallahan.mathtext.domain.equation.StepActionClassification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests keyword classification of step wording.
 */
class StepActionClassifierTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Therefore, x = 5|FINAL",
        "Distribute the 3 across the parentheses|DISTRIBUTE",
        "Combine like terms on the left side|COMBINE_LIKE_TERMS",
        "Simplify the expression|SIMPLIFY",
        "Add 5 to both sides|ADD_SUBTRACT_BOTH_SIDES",
        "Divide both sides by 3|MULTIPLY_DIVIDE_BOTH_SIDES",
        "Factor the quadratic expression|FACTOR",
        "Substitute x = 3 into the equation|SUBSTITUTE",
        "Calculate the final value|EVALUATE",
        "Isolate the variable|ISOLATE_VARIABLE",
        "Check the solution|CHECK",
        "Write the equation|REWRITE"
    })
    void classify_detectsAction(String text, StepAction expected) {
        assertEquals(expected, StepActionClassifier.classify(text).action());
    }

    @Test
    void classify_blankTextIsRewrite() {
        assertEquals(StepAction.REWRITE, StepActionClassifier.classify("  ").action());
        assertEquals(StepAction.REWRITE, StepActionClassifier.classify(null).action());
    }

    @Test
    void classify_attachesOperationOnlyToBothSidesActions() {
        StepActionClassification bothSides = StepActionClassifier.classify("Add 11 to both sides");
        StepActionClassification simplify = StepActionClassifier.classify("Simplify 11 + 4");

        assertEquals(new BothSidesOperation(BothSidesOperation.Type.ADD, "11"), bothSides.bothSidesOperation());
        assertEquals("Add/Subtract both sides", bothSides.label());
        assertNull(simplify.bothSidesOperation());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Add 11 to both sides|ADD|11",
        "Adding 5 to both sides|ADD|5",
        "Subtract 3x from both sides|SUBTRACT|3x",
        "Subtracting 7 from both sides|SUBTRACT|7",
        "Multiply both sides by 2|MULTIPLY|2",
        "Multiplying both sides by {1/2}|MULTIPLY|{1/2}",
        "Divide both sides by 4|DIVIDE|4",
        "Dividing both sides by 3|DIVIDE|3",
        "Add 5 to each side|ADD|5",
        "Add 10 to both sides.|ADD|10",
        "Subtract *x* from both sides|SUBTRACT|*x*"
    })
    void extractBothSidesOperation_parsesOperation(String text, BothSidesOperation.Type type, String operand) {
        assertEquals(new BothSidesOperation(type, operand),
                StepActionClassifier.extractBothSidesOperation(text).orElseThrow());
    }

    @Test
    void extractBothSidesOperation_emptyWithoutBothSidesPhrase() {
        assertFalse(StepActionClassifier.extractBothSidesOperation("Simplify the expression").isPresent());
    }
}
