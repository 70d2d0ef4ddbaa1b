package com.williamcallahan.mathtext.service.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.mathtext.domain.formatting.HighlightColor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Tests consistent color assignment for single-letter variables.
 */
class VariableColorizerTest {

    @Test
    void extractSingleLetterVariables_skipsArticlesAndDuplicates() {
        assertEquals(List.of("x", "y"), VariableColorizer.extractSingleLetterVariables("*x* + *y* = *x* + *a*"));
    }

    @Test
    void buildColorMap_cyclesThroughPalette() {
        Map<String, HighlightColor> colors = VariableColorizer.buildColorMap("*x* *y* *z* *w* *v*");

        assertEquals(HighlightColor.BLUE, colors.get("x"));
        assertEquals(HighlightColor.GREEN, colors.get("y"));
        assertEquals(HighlightColor.ORANGE, colors.get("z"));
        assertEquals(HighlightColor.PURPLE, colors.get("w"));
        assertEquals(HighlightColor.BLUE, colors.get("v"));
    }

    @Test
    void applyColors_wrapsVariablesOutsideExistingTags() {
        Map<String, HighlightColor> colors = Map.of("x", HighlightColor.BLUE);

        assertEquals("[blue:*x*] + 1", VariableColorizer.applyColors("*x* + 1", colors));
        assertEquals("[red:*x*] and [blue:*x*]", VariableColorizer.applyColors("[red:*x*] and *x*", colors));
    }
}
