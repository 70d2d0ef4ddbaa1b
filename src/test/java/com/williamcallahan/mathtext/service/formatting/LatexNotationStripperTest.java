package com.williamcallahan.mathtext.service.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LatexNotationStripperTest {

    @Test
    void stripLatex_rewritesCommandsToInlineNotation() {
        assertEquals("{3/4} × 2", LatexNotationStripper.stripLatex("\\frac{3}{4} \\times 2"));
        assertEquals("x", LatexNotationStripper.stripLatex("\\(x\\)"));
        assertEquals("5 cm", LatexNotationStripper.stripLatex("5 \\text{cm}"));
        assertEquals("√{x}", LatexNotationStripper.stripLatex("\\sqrt{x}"));
    }

    @Test
    void stripLatex_returnsTextWithoutBackslashUnchanged() {
        String plain = "x = {1/2}";

        assertEquals(plain, LatexNotationStripper.stripLatex(plain));
    }
}
