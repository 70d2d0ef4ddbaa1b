package com.williamcallahan.mathtext.domain.solution;

import jakarta.validation.constraints.NotBlank;

/**
 * One step of a solution as it arrives from an upstream generator, before formatting.
 * Only the title is mandatory; every other field may be absent.
 *
 * @param id stable step identifier
 * @param title short heading such as "Step 1: Isolate x"
 * @param equation the math content of the step
 * @param rawEquation unformatted copy of the equation kept for debugging, passed through verbatim
 * @param content optional longer working for the step
 * @param summary one-line description of the step
 * @param explanation optional longer explanation
 */
public record RawSolutionStep(
    String id,
    @NotBlank(message = "Step title cannot be empty") String title,
    String equation,
    String rawEquation,
    String content,
    String summary,
    String explanation
) {
}
