package com.williamcallahan.mathtext.domain.solution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies both wire shapes of a final answer.
 */
class FinalAnswerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void readsPlainStringAsSingleAnswer() throws Exception {
        FinalAnswer answer = MAPPER.readValue("\"x = 8\"", FinalAnswer.class);

        assertFalse(answer.isMultiPart());
        assertEquals("x = 8", answer.text());
        assertEquals("\"x = 8\"", MAPPER.writeValueAsString(answer));
    }

    @Test
    void readsPartsObjectAsMultiPartAnswer() throws Exception {
        FinalAnswer answer = MAPPER.readValue("{\"parts\":[\"x = 1\",\"y = 2\"]}", FinalAnswer.class);

        assertTrue(answer.isMultiPart());
        assertEquals(List.of("x = 1", "y = 2"), answer.parts());
        assertEquals("{\"parts\":[\"x = 1\",\"y = 2\"]}", MAPPER.writeValueAsString(answer));
    }

    @Test
    void mapKeepsShape() {
        FinalAnswer answer = FinalAnswer.ofParts(List.of("a", "b")).map(String::toUpperCase);

        assertEquals(List.of("A", "B"), answer.parts());
        assertEquals("X", FinalAnswer.ofText("x").map(String::toUpperCase).text());
    }

    @Test
    void requiresExactlyOneForm() {
        assertThrows(IllegalArgumentException.class, () -> new FinalAnswer(null, null));
        assertThrows(IllegalArgumentException.class, () -> new FinalAnswer("x", List.of("y")));
        assertFalse(FinalAnswer.ofText("  ").isPresent());
        assertFalse(FinalAnswer.ofParts(List.of()).isPresent());
    }
}
