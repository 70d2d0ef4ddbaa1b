package com.williamcallahan.mathtext.domain.solution;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.mathtext.domain.equation.BothSidesOperation;
import com.williamcallahan.mathtext.domain.equation.Equation;
import com.williamcallahan.mathtext.domain.equation.StepAction;
import com.williamcallahan.mathtext.domain.formatting.ContentKind;
import java.util.List;
import java.util.Objects;

/**
 * A solution step after every field has been routed through canonicalization.
 * Optional fields stay null when the raw step did not carry them.
 *
 * @param id step identifier, unchanged
 * @param title canonical single-line title
 * @param equation formatted math content
 * @param rawEquation raw equation copy, unchanged
 * @param equationKind detected kind of the raw equation field
 * @param content canonical working
 * @param summary formatted summary
 * @param summaryKind detected kind of the raw summary
 * @param explanation formatted explanation
 * @param explanationKind detected kind of the raw explanation
 * @param action classified step action
 * @param actionLabel human-readable label for {@code action}
 * @param bothSidesOperation parsed both-sides operation, when there is one
 * @param equations equations extracted from the formatted math content
 * @param finalEquation the step's most final equation, when one was found
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FormattedSolutionStep(
    String id,
    String title,
    String equation,
    String rawEquation,
    ContentKind equationKind,
    String content,
    String summary,
    ContentKind summaryKind,
    String explanation,
    ContentKind explanationKind,
    StepAction action,
    String actionLabel,
    BothSidesOperation bothSidesOperation,
    List<Equation> equations,
    Equation finalEquation
) {

    public FormattedSolutionStep {
        Objects.requireNonNull(title, "Step title is required");
        Objects.requireNonNull(action, "Step action is required");
        equations = equations == null ? List.of() : List.copyOf(equations);
    }
}
