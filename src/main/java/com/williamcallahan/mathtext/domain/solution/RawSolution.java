package com.williamcallahan.mathtext.domain.solution;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * A complete unformatted solution: problem statement, ordered steps and final answer.
 */
public record RawSolution(
    @NotBlank(message = "Problem cannot be empty") String problem,
    @NotEmpty(message = "Solution must include at least one step") List<@Valid @NotNull RawSolutionStep> steps,
    @NotNull(message = "Final answer is required") @Valid FinalAnswer finalAnswer
) {

    public RawSolution {
        steps = steps == null ? null : List.copyOf(steps);
    }
}
