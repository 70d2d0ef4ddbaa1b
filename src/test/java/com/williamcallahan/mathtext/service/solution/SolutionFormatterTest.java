package com.williamcallahan.mathtext.service.solution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mathtext.config.AppProperties;
import com.williamcallahan.mathtext.domain.equation.BothSidesOperation;
import com.williamcallahan.mathtext.domain.equation.StepAction;
import com.williamcallahan.mathtext.domain.formatting.ContentKind;
import com.williamcallahan.mathtext.domain.formatting.FormattingMode;
import com.williamcallahan.mathtext.domain.solution.FinalAnswer;
import com.williamcallahan.mathtext.domain.solution.FormattedSolution;
import com.williamcallahan.mathtext.domain.solution.FormattedSolutionStep;
import com.williamcallahan.mathtext.domain.solution.RawSolution;
import com.williamcallahan.mathtext.domain.solution.RawSolutionStep;
import com.williamcallahan.mathtext.service.formatting.MathContentCanonicalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests per-field routing, step classification and answer formatting for whole solutions.
 */
class SolutionFormatterTest {
    private static final String CODE_BLOCK = "```javascript\nfunction isPrime(n) {\n  return n > 1;\n}\n```";

    private final AppProperties appProperties = new AppProperties();
    private final SolutionFormatter solutionFormatter =
            new SolutionFormatter(new MathContentCanonicalizer(), appProperties);

    private static RawSolution algebraSolution() {
        return new RawSolution(
                "Solve for x: {3/4}x + 5 = 11",
                List.of(
                        new RawSolutionStep("step-1", "Subtract 5 from both sides",
                                "{3/4}x + 5 - 5 = 11 - 5\n{3/4}x = 6", "raw copy", null,
                                "We subtract 5 from both sides to isolate the term with x.", null),
                        new RawSolutionStep("step-2", "Multiply both sides by {4/3}",
                                "{4/3} × {3/4}x = {4/3} × 6\nx = 8", null, null,
                                "Multiply both sides by the reciprocal of {3/4} to solve for x.", null)),
                FinalAnswer.ofText("x = 8"));
    }

    @Test
    void format_classifiesStepsAndParsesOperations() {
        FormattedSolution formatted = solutionFormatter.format(algebraSolution());
        FormattedSolutionStep first = formatted.steps().get(0);
        FormattedSolutionStep second = formatted.steps().get(1);

        assertEquals(StepAction.ADD_SUBTRACT_BOTH_SIDES, first.action());
        assertEquals(new BothSidesOperation(BothSidesOperation.Type.SUBTRACT, "5"), first.bothSidesOperation());
        assertEquals(StepAction.MULTIPLY_DIVIDE_BOTH_SIDES, second.action());
        assertEquals(new BothSidesOperation(BothSidesOperation.Type.MULTIPLY, "{4/3}"), second.bothSidesOperation());
    }

    @Test
    void format_extractsEquationsAndFinalEquationPerStep() {
        FormattedSolution formatted = solutionFormatter.format(algebraSolution());
        FormattedSolutionStep first = formatted.steps().get(0);
        FormattedSolutionStep second = formatted.steps().get(1);

        assertEquals("{3/4}x = 6", first.finalEquation().text());
        assertEquals("x = 8", second.finalEquation().text());
        assertTrue(first.equations().stream().anyMatch(equation -> equation.text().equals("{3/4}x = 6")));
    }

    @Test
    void format_routesFieldsByDetectedKind() {
        FormattedSolution formatted = solutionFormatter.format(algebraSolution());
        FormattedSolutionStep first = formatted.steps().get(0);

        assertEquals(ContentKind.MATH, first.equationKind());
        assertEquals(ContentKind.PROSE, first.summaryKind());
        assertEquals(ContentKind.MATH, formatted.steps().get(1).summaryKind());
        assertEquals("We subtract 5 from both sides to isolate the term with x.", first.summary());
        assertEquals("x = 8", formatted.finalAnswer().text());
    }

    @Test
    void format_passesIdentifiersAndRawEquationThrough() {
        FormattedSolutionStep first = solutionFormatter.format(algebraSolution()).steps().get(0);

        assertEquals("step-1", first.id());
        assertEquals("raw copy", first.rawEquation());
    }

    @Test
    void format_leavesAbsentFieldsNull() {
        FormattedSolutionStep first = solutionFormatter.format(algebraSolution()).steps().get(0);

        assertNull(first.explanation());
        assertNull(first.explanationKind());
        assertNull(first.content());
    }

    @Test
    void format_leavesCodeUntouched() {
        RawSolution solution = new RawSolution(
                "Write a function to check if a number is prime.",
                List.of(new RawSolutionStep(null, "Define the function", CODE_BLOCK, null, null, null, null)),
                FinalAnswer.ofText("The isPrime function returns true for primes."));

        FormattedSolutionStep step = solutionFormatter.format(solution).steps().get(0);

        assertEquals(CODE_BLOCK, step.equation());
        assertEquals(ContentKind.CODE, step.equationKind());
        assertTrue(step.equations().isEmpty());
        assertNull(step.finalEquation());
    }

    @Test
    void format_stripsReservedMarkersFromCodeKeepingLayout() {
        RawSolution solution = new RawSolution(
                "```\nint v = PLACEHOLDER_1;\n```",
                List.of(new RawSolutionStep(null, "Return early", "```\n  return LIST_BREAK;\n```",
                        null, null, null, null)),
                FinalAnswer.ofText("return PLACEHOLDER_2;"));

        FormattedSolution formatted = solutionFormatter.format(solution, FormattingMode.STRICT);
        FormattedSolutionStep step = formatted.steps().get(0);

        assertEquals("```\nint v = ;\n```", formatted.problem());
        assertEquals("```\n  return ;\n```", step.equation());
        assertEquals(ContentKind.CODE, step.equationKind());
        assertEquals("return ;", formatted.finalAnswer().text());
        assertTrue(formatted.diagnostics().isEmpty());
    }

    @Test
    void format_neverColorsCodeFields() {
        appProperties.getFormatting().setColorizeVariables(true);
        String codeProblem = "```\nint y = *p* + *q*;\n```";
        RawSolution solution = new RawSolution(
                codeProblem,
                List.of(new RawSolutionStep(null, "Add the terms", "*p* + *q* = 10", null, null, null, null)),
                FinalAnswer.ofText("return *p*;"));

        FormattedSolution formatted = solutionFormatter.format(solution);

        assertEquals(codeProblem, formatted.problem());
        assertEquals("[blue:*p*] + [green:*q*] = 10", formatted.steps().get(0).equation());
        assertEquals("return *p*;", formatted.finalAnswer().text());
    }

    @Test
    void format_keepsMultiPartAnswerShape() {
        RawSolution solution = new RawSolution(
                "Solve both parts",
                List.of(new RawSolutionStep(null, "Solve", "x = 5", null, null, null, null)),
                FinalAnswer.ofParts(List.of("x +\n5 = 10", "y = 2")));

        FinalAnswer answer = solutionFormatter.format(solution, FormattingMode.STRICT).finalAnswer();

        assertTrue(answer.isMultiPart());
        assertEquals(List.of("x + 5 = 10", "y = 2"), answer.parts());
    }

    @Test
    void format_colorsVariablesConsistentlyWhenEnabled() {
        appProperties.getFormatting().setColorizeVariables(true);
        RawSolution solution = new RawSolution(
                "Solve for *x*: 2*x* = 6",
                List.of(new RawSolutionStep(null, "Divide both sides by 2", "*x* = 3", null, null, null, null)),
                FinalAnswer.ofText("*x* = 3"));

        FormattedSolution formatted = solutionFormatter.format(solution);

        assertEquals("Solve for [blue:*x*]: 2[blue:*x*] = 6", formatted.problem());
        assertEquals("[blue:*x*] = 3", formatted.steps().get(0).equation());
        assertEquals("[blue:*x*] = 3", formatted.finalAnswer().text());
        assertEquals(new BothSidesOperation(BothSidesOperation.Type.DIVIDE, "2"),
                formatted.steps().get(0).bothSidesOperation());
    }

    @Test
    void format_reportsNoDiagnosticsForCleanInput() {
        assertTrue(solutionFormatter.format(algebraSolution(), FormattingMode.STRICT).diagnostics().isEmpty());
    }
}
