package com.williamcallahan.mathtext.service.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests conversion of fraction spellings to brace form.
 */
class FractionNormalizerTest {

    @Test
    void normalizeFractionForms_convertsParenthesizedFractions() {
        assertEquals("{3/4} + {x/2} + {-3/4}",
                FractionNormalizer.normalizeFractionForms("(3/4) + (x/2) + (-3/4)"));
    }

    @Test
    void normalizeFractionForms_marksWordRatiosWithDivisionSlash() {
        assertEquals("rise" + FractionNormalizer.RATIO_SLASH + "run",
                FractionNormalizer.normalizeFractionForms("rise/run"));
    }

    @Test
    void normalizeFractionForms_leavesFileUrisAlone() {
        assertEquals("[IMAGE: graph](file:///tmp/a/b.png) {1/2}",
                FractionNormalizer.normalizeFractionForms("[IMAGE: graph](file:///tmp/a/b.png) (1/2)"));
    }

    @Test
    void normalizeFractionWhitespace_trimsInsideBraces() {
        assertEquals("{3/4} and {x/2}", FractionNormalizer.normalizeFractionWhitespace("{ 3 / 4 } and {x / 2 }"));
    }

    @Test
    void normalizeFractionMultiplication_insertsTimesBeforeDigitOrParen() {
        assertEquals("{1/2} × 6", FractionNormalizer.normalizeFractionMultiplication("{1/2}6"));
        assertEquals("{1/2} × (x)", FractionNormalizer.normalizeFractionMultiplication("{1/2}(x)"));
        assertEquals("{3/4} × 8", FractionNormalizer.normalizeFractionMultiplication("{3/4}*8"));
    }

    @Test
    void normalizeFractionMultiplication_keepsCoefficients() {
        assertEquals("{3/4}y", FractionNormalizer.normalizeFractionMultiplication("{3/4}y"));
        assertEquals("{1/2}*m*", FractionNormalizer.normalizeFractionMultiplication("{1/2}*m*"));
    }

    @Test
    void convertRawFractions_handlesVulgarAndInlineForms() {
        assertEquals("{3/4} cup", FractionNormalizer.convertRawFractions("¾ cup"));
        assertEquals("{3/4}", FractionNormalizer.convertRawFractions("(3)/(4)"));
        assertEquals("x = {7/5}", FractionNormalizer.convertRawFractions("x = 7/5"));
    }

    @Test
    void repairMalformedBraces_closesAndTrimsBraces() {
        assertEquals("{3/4}", FractionNormalizer.repairMalformedBraces("{3/4"));
        assertEquals("{3 / 4}", FractionNormalizer.repairMalformedBraces("{ 3 / 4 }"));
    }
}
