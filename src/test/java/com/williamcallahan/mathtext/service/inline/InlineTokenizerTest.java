package com.williamcallahan.mathtext.service.inline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mathtext.domain.formatting.CanonicalText;
import com.williamcallahan.mathtext.domain.formatting.HighlightColor;
import com.williamcallahan.mathtext.domain.formatting.InlineElement;
import com.williamcallahan.mathtext.domain.formatting.InlineElement.Arrow;
import com.williamcallahan.mathtext.domain.formatting.InlineElement.Fraction;
import com.williamcallahan.mathtext.domain.formatting.InlineElement.FractionWithText;
import com.williamcallahan.mathtext.domain.formatting.InlineElement.Highlighted;
import com.williamcallahan.mathtext.domain.formatting.InlineElement.Image;
import com.williamcallahan.mathtext.domain.formatting.InlineElement.Italic;
import com.williamcallahan.mathtext.domain.formatting.InlineElement.Text;
import com.williamcallahan.mathtext.domain.formatting.RenderMode;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests the inline scanner's productions and its fallback to literal text.
 */
class InlineTokenizerTest {

    @Test
    void tokenizeLine_emitsTextAndFraction() {
        assertEquals(List.of(new Text("The slope is "), new Fraction("3", "4")),
                InlineTokenizer.tokenizeLine("The slope is {3/4}"));
    }

    @Test
    void tokenizeLine_mergesFractionWithSingleLetterCoefficient() {
        assertEquals(List.of(new FractionWithText(new Fraction("3", "4"), "y"), new Text(" = 6")),
                InlineTokenizer.tokenizeLine("{3/4}y = 6"));
    }

    @Test
    void tokenizeLine_keepsMultiLetterTextSeparateFromFraction() {
        assertEquals(List.of(new Fraction("1", "2"), new Text("mv")), InlineTokenizer.tokenizeLine("{1/2}mv"));
    }

    @Test
    void tokenizeLine_absorbsScriptsIntoItalic() {
        assertEquals(List.of(new Italic("v_0_"), new Text(" = 5")), InlineTokenizer.tokenizeLine("*v*_0_ = 5"));
    }

    @Test
    void tokenizeLine_normalizesArrows() {
        assertEquals(List.of(new Text("x "), Arrow.right(), new Text(" 5")), InlineTokenizer.tokenizeLine("x → 5"));
        assertEquals(List.of(new Text("a "), Arrow.right(), new Text(" b")), InlineTokenizer.tokenizeLine("a -> b"));
        assertEquals(List.of(new Text("p "), Arrow.right(), new Text(" q")), InlineTokenizer.tokenizeLine("p => q"));
        assertEquals(List.of(new Text("p "), Arrow.right(), new Text(" q")), InlineTokenizer.tokenizeLine("p ⇒ q"));
    }

    @Test
    void tokenizeLine_readsColorTags() {
        assertEquals(List.of(Highlighted.colored("x = 5", HighlightColor.RED)),
                InlineTokenizer.tokenizeLine("[red:x = 5]"));
        assertEquals(List.of(Highlighted.colored("hi", HighlightColor.DEFAULT)),
                InlineTokenizer.tokenizeLine("[cyan:hi]"));
    }

    @Test
    void tokenizeLine_readsImageAndRestoresSlashesInFileUrl() {
        assertEquals(List.of(new Image("file:///tmp/a/b.png", "graph")),
                InlineTokenizer.tokenizeLine("[IMAGE: graph](file:///tmp/a∕b.png)"));
    }

    @Test
    void tokenizeLine_underlinesOnlyStandaloneRuns() {
        assertEquals(List.of(new Text("an "), Highlighted.underlined("important"), new Text(" word")),
                InlineTokenizer.tokenizeLine("an _important_ word"));
        assertEquals(List.of(new Text("v_0_")), InlineTokenizer.tokenizeLine("v_0_"));
    }

    @Test
    void tokenizeLine_degradesMalformedMarkupToText() {
        assertEquals(List.of(new Text("{3/4 + 1")), InlineTokenizer.tokenizeLine("{3/4 + 1"));
        assertEquals(List.of(new Text("[note]")), InlineTokenizer.tokenizeLine("[note]"));
    }

    @Test
    void tokenize_yieldsEmptyListForBlankLine() {
        List<List<InlineElement>> lines = InlineTokenizer.tokenize(CanonicalText.of("x = 1\n\ny = 2", RenderMode.EQUATION));

        assertEquals(3, lines.size());
        assertTrue(lines.get(1).isEmpty());
        assertEquals(List.of(new Text("y = 2")), lines.get(2));
    }
}
