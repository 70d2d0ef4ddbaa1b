package com.williamcallahan.mathtext.service.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.mathtext.domain.formatting.ContentKind;
import org.junit.jupiter.api.Test;

class ContentKindDetectorTest {

    @Test
    void detect_treatsBlankAsProse() {
        assertEquals(ContentKind.PROSE, ContentKindDetector.detect(null));
        assertEquals(ContentKind.PROSE, ContentKindDetector.detect("   "));
    }

    @Test
    void detect_recognizesCode() {
        assertEquals(ContentKind.CODE, ContentKindDetector.detect("```js\nconst x = 1;\n```"));
        assertEquals(ContentKind.CODE, ContentKindDetector.detect("return x;"));
        assertEquals(ContentKind.CODE, ContentKindDetector.detect("def is_prime(n):"));
    }

    @Test
    void detect_recognizesMath() {
        assertEquals(ContentKind.MATH, ContentKindDetector.detect("x = 5"));
        assertEquals(ContentKind.MATH, ContentKindDetector.detect("{1/2}"));
        assertEquals(ContentKind.MATH, ContentKindDetector.detect("The answer is [red:5]"));
        assertEquals(ContentKind.MATH, ContentKindDetector.detect("x^2^"));
    }

    @Test
    void detect_recognizesListsAndProse() {
        assertEquals(ContentKind.LIST, ContentKindDetector.detect("A. First option\nB. Second option"));
        assertEquals(ContentKind.LIST, ContentKindDetector.detect("1. Mix the batter"));
        assertEquals(ContentKind.LIST, ContentKindDetector.detect("- item"));
        assertEquals(ContentKind.PROSE, ContentKindDetector.detect("The sky is blue."));
    }
}
