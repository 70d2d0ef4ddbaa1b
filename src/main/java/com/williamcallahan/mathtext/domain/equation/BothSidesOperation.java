package com.williamcallahan.mathtext.domain.equation;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;

/**
 * An operation applied to both sides of an equation, such as "subtract 5".
 *
 * @param type arithmetic operation
 * @param operand the value or expression operated with, as written
 */
public record BothSidesOperation(Type type, String operand) {

    public BothSidesOperation {
        Objects.requireNonNull(type, "Operation type is required");
        if (operand == null || operand.isBlank()) {
            throw new IllegalArgumentException("Operand cannot be blank");
        }
        operand = operand.trim();
    }

    /**
     * Arithmetic applied to both sides.
     */
    public enum Type {
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE;

        @JsonValue
        public String token() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
