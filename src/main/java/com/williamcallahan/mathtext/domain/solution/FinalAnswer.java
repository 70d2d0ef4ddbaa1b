package com.williamcallahan.mathtext.domain.solution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.constraints.AssertTrue;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A solution's final answer: either a single text or a list of parts.
 *
 * <p>On the wire the single form is a plain JSON string and the multi-part form is
 * {@code {"parts": [...]}}.</p>
 *
 * @param text single answer text, null for the multi-part form
 * @param parts answer parts, null for the single form
 */
public record FinalAnswer(String text, List<String> parts) {

    public FinalAnswer {
        if ((text == null) == (parts == null)) {
            throw new IllegalArgumentException("Final answer must be either a text or a list of parts");
        }
        parts = parts == null ? null : List.copyOf(parts);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FinalAnswer ofText(String text) {
        return new FinalAnswer(text, null);
    }

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public static FinalAnswer ofParts(@JsonProperty("parts") List<String> parts) {
        return new FinalAnswer(null, parts);
    }

    public boolean isMultiPart() {
        return parts != null;
    }

    /**
     * Applies a formatter to the text or to every part, keeping the shape.
     */
    public FinalAnswer map(UnaryOperator<String> formatter) {
        if (isMultiPart()) {
            return ofParts(parts.stream().map(formatter).toList());
        }
        return ofText(formatter.apply(text));
    }

    @AssertTrue(message = "Final answer cannot be empty")
    public boolean isPresent() {
        if (isMultiPart()) {
            return !parts.isEmpty() && parts.stream().allMatch(part -> part != null && !part.isBlank());
        }
        return !text.isBlank();
    }

    @JsonValue
    public Object jsonValue() {
        return isMultiPart() ? Map.of("parts", parts) : text;
    }
}
