package com.williamcallahan.mathtext.domain.equation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of classifying a step's wording.
 *
 * @param action detected action
 * @param bothSidesOperation the parsed operation, present only for both-sides steps whose wording
 *     names one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepActionClassification(StepAction action, BothSidesOperation bothSidesOperation) {

    public StepActionClassification {
        Objects.requireNonNull(action, "Step action is required");
    }

    public static StepActionClassification of(StepAction action) {
        return new StepActionClassification(action, null);
    }

    @JsonProperty("label")
    public String label() {
        return action.label();
    }

    public Optional<BothSidesOperation> operation() {
        return Optional.ofNullable(bothSidesOperation);
    }
}
