package com.williamcallahan.mathtext.service.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests paragraph breaks before step instructions and run-on list items.
 */
class ListStepSegmenterTest {

    @Test
    void insertStepBreaks_breaksBeforeCapitalizedInstruction() {
        String marked = ListStepSegmenter.insertStepBreaks(
                "Start with the equation: x + 5 = 10 Subtract 5 from both sides: x = 5");

        assertEquals("Start with the equation: x + 5 = 10\n\nSubtract 5 from both sides: x = 5",
                ListStepSegmenter.resolveBreaks(marked));
    }

    @Test
    void insertStepBreaks_leavesLowercaseKeywordsInSentence() {
        String sentence = "Next we subtract 5 from both sides";

        assertEquals(sentence, ListStepSegmenter.insertStepBreaks(sentence));
    }

    @Test
    void insertStepBreaks_breaksBeforeLowercaseInstructionAfterEquation() {
        String marked = ListStepSegmenter.insertStepBreaks("x + 5 = 10 subtract 5 from both sides");

        assertEquals("x + 5 = 10\n\nsubtract 5 from both sides", ListStepSegmenter.resolveBreaks(marked));
    }

    @Test
    void insertListBreaks_keepsFirstOptionWithQuestion() {
        String marked = ListStepSegmenter.insertListBreaks("Which of these is a prime number? A. first B. second");

        assertEquals("Which of these is a prime number? A. first\n\nB. second", ListStepSegmenter.resolveBreaks(marked));
    }

    @Test
    void insertListBreaks_breaksEveryLaterOption() {
        String marked = ListStepSegmenter.insertListBreaks(
                "Which of the following is a prime number? A. 4 B. 6 C. 7 D. 9");

        assertEquals("Which of the following is a prime number? A. 4\n\nB. 6\n\nC. 7\n\nD. 9",
                ListStepSegmenter.resolveBreaks(marked));
    }

    @Test
    void insertListBreaks_breaksNumberedItems() {
        String marked = ListStepSegmenter.insertListBreaks("Follow these instructions carefully: 1. mix 2. bake");

        assertEquals("Follow these instructions carefully: 1. mix\n\n2. bake", ListStepSegmenter.resolveBreaks(marked));
    }

    @Test
    void insertListBreaks_isStableOnItsOwnOutput() {
        String once = ListStepSegmenter.resolveBreaks(ListStepSegmenter.insertListBreaks(
                "Which of the following is a prime number? A. 4 B. 6 C. 7 D. 9"));

        assertEquals(once, ListStepSegmenter.resolveBreaks(ListStepSegmenter.insertListBreaks(once)));
    }

    @Test
    void protectParagraphs_replacesBlankLinesWithSentinel() {
        assertEquals("a" + ListStepSegmenter.PARAGRAPH_BREAK + "b", ListStepSegmenter.protectParagraphs("a\n  \n\nb"));
    }
}
