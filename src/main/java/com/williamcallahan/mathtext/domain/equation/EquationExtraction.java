package com.williamcallahan.mathtext.domain.equation;

import java.util.List;
import java.util.Optional;

/**
 * Equations found in a block of content, plus the non-noise lines that held none.
 *
 * @param equations unique equations in first-seen order
 * @param contentRows lines worth showing that contained no equation
 */
public record EquationExtraction(List<Equation> equations, List<String> contentRows) {

    public EquationExtraction {
        equations = equations == null ? List.of() : List.copyOf(equations);
        contentRows = contentRows == null ? List.of() : List.copyOf(contentRows);
    }

    public static EquationExtraction empty() {
        return new EquationExtraction(List.of(), List.of());
    }

    /**
     * Returns the last extracted equation, which is usually the result of the step.
     */
    public Optional<Equation> lastEquation() {
        return equations.isEmpty() ? Optional.empty() : Optional.of(equations.get(equations.size() - 1));
    }
}
