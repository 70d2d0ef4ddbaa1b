package com.williamcallahan.mathtext.domain.formatting;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Objects;

/**
 * One renderable span produced by tokenizing a line of canonical text.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = InlineElement.Text.class, name = "text"),
    @JsonSubTypes.Type(value = InlineElement.Fraction.class, name = "fraction"),
    @JsonSubTypes.Type(value = InlineElement.FractionWithText.class, name = "fraction_with_text"),
    @JsonSubTypes.Type(value = InlineElement.Highlighted.class, name = "highlighted"),
    @JsonSubTypes.Type(value = InlineElement.Italic.class, name = "italic"),
    @JsonSubTypes.Type(value = InlineElement.Arrow.class, name = "arrow"),
    @JsonSubTypes.Type(value = InlineElement.Image.class, name = "image")
})
public sealed interface InlineElement {

    /**
     * Literal text. Empty content is allowed so round-tripping never loses spans.
     */
    record Text(String content) implements InlineElement {
        public Text {
            Objects.requireNonNull(content, "Text content is required");
        }
    }

    /**
     * A {@code {numerator/denominator}} fraction with both parts trimmed.
     */
    record Fraction(String numerator, String denominator) implements InlineElement {
        public Fraction {
            Objects.requireNonNull(numerator, "Numerator is required");
            Objects.requireNonNull(denominator, "Denominator is required");
        }
    }

    /**
     * A fraction glued to the single-letter coefficient that follows it, such as {@code {3/4}y}.
     */
    record FractionWithText(Fraction fraction, String text) implements InlineElement {
        public FractionWithText {
            Objects.requireNonNull(fraction, "Fraction is required");
            Objects.requireNonNull(text, "Attached text is required");
        }
    }

    /**
     * Colored and/or underlined text. {@code color} is null for a plain underline.
     */
    record Highlighted(String content, HighlightColor color, boolean underline) implements InlineElement {
        public Highlighted {
            Objects.requireNonNull(content, "Highlighted content is required");
        }

        public static Highlighted colored(String content, HighlightColor color) {
            return new Highlighted(content, Objects.requireNonNull(color, "Color is required"), false);
        }

        public static Highlighted underlined(String content) {
            return new Highlighted(content, null, true);
        }
    }

    /**
     * A variable or short identifier written as {@code *x*}, including any attached sub/superscript.
     */
    record Italic(String content) implements InlineElement {
        public Italic {
            Objects.requireNonNull(content, "Italic content is required");
        }
    }

    /**
     * A rightward arrow; every accepted arrow spelling normalizes to the same glyph.
     */
    record Arrow(String symbol) implements InlineElement {
        public static final String RIGHT_ARROW = "→";

        public Arrow {
            symbol = symbol == null ? RIGHT_ARROW : symbol;
        }

        public static Arrow right() {
            return new Arrow(RIGHT_ARROW);
        }
    }

    /**
     * An embedded image reference written as {@code [IMAGE: description](url)}.
     */
    record Image(String url, String description) implements InlineElement {
        public Image {
            Objects.requireNonNull(url, "Image url is required");
            description = description == null ? "" : description;
        }
    }
}
