package com.williamcallahan.mathtext.service.inline;

import com.williamcallahan.mathtext.domain.formatting.CanonicalText;
import com.williamcallahan.mathtext.domain.formatting.HighlightColor;
import com.williamcallahan.mathtext.domain.formatting.InlineElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cursor-based scanner that turns one line of canonical text into inline elements.
 *
 * <p>Productions are tried in a fixed priority order at every position: italics, image, arrow,
 * fraction, color tag, underline. Anything that matches none of them accumulates into a text
 * buffer that is flushed when a production fires. Malformed markup degrades to literal text.</p>
 */
public final class InlineTokenizer {
    private static final int MAX_ITALIC_LENGTH = 10;
    private static final int MAX_SCRIPT_LENGTH = 10;
    private static final String IMAGE_PREFIX = "[image:";
    private static final String FILE_SCHEME = "file:";
    private static final char RATIO_SLASH = '∕';
    private static final List<String> ARROW_GLYPHS = List.of("->", "=>", "→", "⟶", "⇒", "⟹", "➔", "➝", "➞", "➟");
    private static final Pattern COLOR_TAG = Pattern.compile("\\[([a-zA-Z]+):([^\\]\\n]*)\\]");
    private static final Pattern EMBEDDED_COLOR_TAG = Pattern.compile("\\[[a-zA-Z]+:([^\\]]*)\\]");

    private InlineTokenizer() {}

    /**
     * Tokenizes every line of canonical text. Blank lines yield empty element lists.
     */
    public static List<List<InlineElement>> tokenize(CanonicalText text) {
        List<List<InlineElement>> lines = new ArrayList<>();
        for (String line : text.lines()) {
            lines.add(tokenizeLine(line));
        }
        return lines;
    }

    /**
     * Tokenizes a single line.
     *
     * @param line one line of canonical text, without line breaks
     * @return elements in render order
     */
    public static List<InlineElement> tokenizeLine(String line) {
        if (line == null || line.isEmpty()) {
            return List.of();
        }
        List<InlineElement> elements = new ArrayList<>();
        StringBuilder textBuffer = new StringBuilder();
        int cursor = 0;
        while (cursor < line.length()) {
            Optional<ScanMatch> match = scanAt(line, cursor);
            if (match.isPresent()) {
                flushText(textBuffer, elements);
                elements.add(match.get().element());
                cursor = match.get().afterIndex();
            } else {
                textBuffer.append(line.charAt(cursor));
                cursor++;
            }
        }
        flushText(textBuffer, elements);
        return mergeFractionCoefficients(elements);
    }

    private static Optional<ScanMatch> scanAt(String line, int cursor) {
        char current = line.charAt(cursor);
        if (current == '*') {
            Optional<ScanMatch> italic = scanItalic(line, cursor);
            if (italic.isPresent()) {
                return italic;
            }
        }
        if (current == '[') {
            Optional<ScanMatch> image = scanImage(line, cursor);
            if (image.isPresent()) {
                return image;
            }
        }
        Optional<ScanMatch> arrow = scanArrow(line, cursor);
        if (arrow.isPresent()) {
            return arrow;
        }
        if (current == '{') {
            Optional<ScanMatch> fraction = scanFraction(line, cursor);
            if (fraction.isPresent()) {
                return fraction;
            }
        }
        if (current == '[') {
            Optional<ScanMatch> colorTag = scanColorTag(line, cursor);
            if (colorTag.isPresent()) {
                return colorTag;
            }
        }
        if (current == '_') {
            return scanUnderline(line, cursor);
        }
        return Optional.empty();
    }

    private static Optional<ScanMatch> scanItalic(String line, int start) {
        int closing = findClosing(line, start + 1, '*', MAX_ITALIC_LENGTH);
        if (closing < 0) {
            return Optional.empty();
        }
        String identifier = line.substring(start + 1, closing);
        if (!Character.isLetter(identifier.charAt(0))) {
            return Optional.empty();
        }
        int afterIndex = closing + 1;
        boolean absorbed = true;
        while (absorbed && afterIndex < line.length()) {
            absorbed = false;
            char next = line.charAt(afterIndex);
            if (next == '_' || next == '^') {
                int scriptClose = findClosing(line, afterIndex + 1, next, MAX_SCRIPT_LENGTH);
                if (scriptClose > 0) {
                    afterIndex = scriptClose + 1;
                    absorbed = true;
                }
            }
        }
        String scripts = line.substring(closing + 1, afterIndex);
        return Optional.of(new ScanMatch(new InlineElement.Italic(identifier + scripts), afterIndex));
    }

    private static Optional<ScanMatch> scanImage(String line, int start) {
        if (!line.regionMatches(true, start, IMAGE_PREFIX, 0, IMAGE_PREFIX.length())) {
            return Optional.empty();
        }
        int descriptionEnd = line.indexOf("](", start + IMAGE_PREFIX.length());
        if (descriptionEnd < 0) {
            return Optional.empty();
        }
        int urlEnd = line.indexOf(')', descriptionEnd + 2);
        if (urlEnd < 0) {
            return Optional.empty();
        }
        String description = line.substring(start + IMAGE_PREFIX.length(), descriptionEnd).trim();
        String url = line.substring(descriptionEnd + 2, urlEnd).trim();
        if (url.isEmpty()) {
            return Optional.empty();
        }
        if (url.toLowerCase(Locale.ROOT).contains(FILE_SCHEME)) {
            url = url.replace(RATIO_SLASH, '/');
        }
        return Optional.of(new ScanMatch(new InlineElement.Image(url, description), urlEnd + 1));
    }

    private static Optional<ScanMatch> scanArrow(String line, int start) {
        for (String glyph : ARROW_GLYPHS) {
            if (line.startsWith(glyph, start)) {
                return Optional.of(new ScanMatch(InlineElement.Arrow.right(), start + glyph.length()));
            }
        }
        return Optional.empty();
    }

    private static Optional<ScanMatch> scanFraction(String line, int start) {
        int closing = line.indexOf('}', start + 1);
        if (closing < 0) {
            return Optional.empty();
        }
        String inner = line.substring(start + 1, closing);
        if (inner.indexOf('{') >= 0) {
            return Optional.empty();
        }
        String plain = EMBEDDED_COLOR_TAG.matcher(inner).replaceAll("$1");
        int slash = plain.indexOf('/');
        if (slash < 0) {
            return Optional.empty();
        }
        String numerator = plain.substring(0, slash).trim();
        String denominator = plain.substring(slash + 1).trim();
        if (numerator.isEmpty() || denominator.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ScanMatch(new InlineElement.Fraction(numerator, denominator), closing + 1));
    }

    private static Optional<ScanMatch> scanColorTag(String line, int start) {
        Matcher matcher = COLOR_TAG.matcher(line);
        matcher.region(start, line.length());
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        HighlightColor color = HighlightColor.fromTokenOrDefault(matcher.group(1));
        InlineElement element = InlineElement.Highlighted.colored(matcher.group(2), color);
        return Optional.of(new ScanMatch(element, matcher.end()));
    }

    private static Optional<ScanMatch> scanUnderline(String line, int start) {
        if (start > 0 && Character.isLetterOrDigit(line.charAt(start - 1))) {
            return Optional.empty();
        }
        int closing = line.indexOf('_', start + 1);
        if (closing <= start + 1) {
            return Optional.empty();
        }
        int afterIndex = closing + 1;
        if (afterIndex < line.length() && Character.isLetterOrDigit(line.charAt(afterIndex))) {
            return Optional.empty();
        }
        String content = line.substring(start + 1, closing);
        return Optional.of(new ScanMatch(InlineElement.Highlighted.underlined(content), afterIndex));
    }

    /**
     * Finds the closing marker for a short run with no whitespace, or -1.
     */
    private static int findClosing(String line, int contentStart, char marker, int maxLength) {
        int limit = Math.min(line.length(), contentStart + maxLength + 1);
        for (int index = contentStart; index < limit; index++) {
            char current = line.charAt(index);
            if (current == marker) {
                return index > contentStart ? index : -1;
            }
            if (Character.isWhitespace(current)) {
                return -1;
            }
        }
        return -1;
    }

    private static void flushText(StringBuilder textBuffer, List<InlineElement> elements) {
        if (textBuffer.length() > 0) {
            elements.add(new InlineElement.Text(textBuffer.toString()));
            textBuffer.setLength(0);
        }
    }

    /**
     * Glues a fraction to a directly following single letter so a coefficient like
     * {@code {3/4}y} renders as one unit.
     */
    private static List<InlineElement> mergeFractionCoefficients(List<InlineElement> elements) {
        List<InlineElement> merged = new ArrayList<>(elements.size());
        for (int index = 0; index < elements.size(); index++) {
            InlineElement element = elements.get(index);
            if (element instanceof InlineElement.Fraction fraction && index + 1 < elements.size()
                    && elements.get(index + 1) instanceof InlineElement.Text following
                    && startsWithBareLetter(following.content())) {
                merged.add(new InlineElement.FractionWithText(fraction, following.content().substring(0, 1)));
                String remainder = following.content().substring(1);
                if (!remainder.isEmpty()) {
                    merged.add(new InlineElement.Text(remainder));
                }
                index++;
                continue;
            }
            merged.add(element);
        }
        return merged;
    }

    private static boolean startsWithBareLetter(String content) {
        if (content.isEmpty() || !Character.isLetter(content.charAt(0))) {
            return false;
        }
        return content.length() == 1 || !Character.isLetterOrDigit(content.charAt(1));
    }

    private record ScanMatch(InlineElement element, int afterIndex) {
    }
}
