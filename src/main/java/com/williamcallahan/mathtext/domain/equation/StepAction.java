package com.williamcallahan.mathtext.domain.equation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kind of algebraic move a solution step performs.
 */
public enum StepAction {
    REWRITE("rewrite", "Rewrite"),
    DISTRIBUTE("distribute", "Distribute"),
    COMBINE_LIKE_TERMS("combine_like_terms", "Combine like terms"),
    SIMPLIFY("simplify", "Simplify"),
    ADD_SUBTRACT_BOTH_SIDES("add_subtract_both_sides", "Add/Subtract both sides"),
    MULTIPLY_DIVIDE_BOTH_SIDES("multiply_divide_both_sides", "Multiply/Divide both sides"),
    ISOLATE_VARIABLE("isolate_variable", "Isolate variable"),
    FACTOR("factor", "Factor"),
    SUBSTITUTE("substitute", "Substitute"),
    EVALUATE("evaluate", "Evaluate"),
    CHECK("check", "Check"),
    FINAL("final", "Final answer");

    private final String token;
    private final String label;

    StepAction(String token, String label) {
        this.token = token;
        this.label = label;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Short human-readable label shown next to a step.
     */
    public String label() {
        return label;
    }
}
