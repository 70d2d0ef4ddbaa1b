package com.williamcallahan.mathtext.domain.solution;

import com.williamcallahan.mathtext.domain.formatting.FormattingDiagnostic;
import java.util.List;
import java.util.Objects;

/**
 * A solution whose every user-visible field is canonical.
 *
 * @param problem canonical problem statement
 * @param steps formatted steps in their original order
 * @param finalAnswer canonical final answer, in the same shape as the raw one
 * @param diagnostics marker leaks stripped while formatting, across all fields
 */
public record FormattedSolution(
    String problem,
    List<FormattedSolutionStep> steps,
    FinalAnswer finalAnswer,
    List<FormattingDiagnostic> diagnostics
) {

    public FormattedSolution {
        Objects.requireNonNull(problem, "Problem is required");
        Objects.requireNonNull(finalAnswer, "Final answer is required");
        steps = steps == null ? List.of() : List.copyOf(steps);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
