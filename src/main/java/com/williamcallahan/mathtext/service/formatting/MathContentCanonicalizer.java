package com.williamcallahan.mathtext.service.formatting;

import com.williamcallahan.mathtext.config.AppProperties;
import com.williamcallahan.mathtext.domain.formatting.CanonicalText;
import com.williamcallahan.mathtext.domain.formatting.ContentKind;
import com.williamcallahan.mathtext.domain.formatting.FormattingMode;
import com.williamcallahan.mathtext.domain.formatting.FormattingResult;
import com.williamcallahan.mathtext.domain.formatting.RenderMode;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Entry point for turning raw generated text into {@link CanonicalText}.
 *
 * <p>Title text collapses to one line, prose joins its lines, and equation text runs the full
 * repair pipeline followed by the structural pass, repeated until the output is stable so that
 * canonicalizing canonical text changes nothing. Every mode ends at the leak guard.</p>
 *
 * <p>The service is stateless; all per-call state lives in local mask arenas.</p>
 */
@Service
public class MathContentCanonicalizer {
    private static final Logger logger = LoggerFactory.getLogger(MathContentCanonicalizer.class);

    private static final String DEFAULT_CONTEXT = "text";
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern PROSE_LINE_BREAK = Pattern.compile("\\s*\\n+\\s*");
    private static final Pattern ARROW_WITH_SPACING = Pattern.compile("\\s*→\\s*");
    private static final Pattern DIGIT_UNDERSCORE_PAREN = Pattern.compile("(\\d+)_+\\)");
    private static final Pattern DIGIT_UNDERSCORE_OPERATOR = Pattern.compile("(\\d+)_+([+\\-*/])");
    private static final Pattern DIGIT_UNDERSCORE_SPACE = Pattern.compile("(\\d+)_+\\s");
    private static final Pattern MULTI_WHITESPACE = Pattern.compile("\\s{2,}");
    private static final Pattern TRAILING_LINE_SPACE = Pattern.compile("(?m)[ \\t]+$");
    private static final Pattern SPACE_BEFORE_NEWLINE = Pattern.compile("[ \\t]+\\n");
    private static final Pattern HORIZONTAL_SPACE_RUN = Pattern.compile("[ \\t]{2,}");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final ContentPipeline pipeline;
    private final int iterationCap;
    private final FormattingMode defaultFormattingMode;

    /**
     * Creates a lenient canonicalizer with the default iteration cap.
     */
    public MathContentCanonicalizer() {
        this(BoundedRewrite.DEFAULT_ITERATION_CAP, FormattingMode.LENIENT);
    }

    /**
     * Creates a canonicalizer configured from {@code app.formatting.*}.
     */
    @Autowired
    public MathContentCanonicalizer(AppProperties appProperties) {
        this(appProperties.getFormatting().getIterationCap(),
                FormattingMode.of(appProperties.getFormatting().isStrict()));
    }

    MathContentCanonicalizer(int iterationCap, FormattingMode defaultFormattingMode) {
        if (iterationCap < 1) {
            throw new IllegalArgumentException("Iteration cap must be positive");
        }
        this.iterationCap = iterationCap;
        this.defaultFormattingMode = Objects.requireNonNull(defaultFormattingMode, "Formatting mode is required");
        this.pipeline = new ContentPipeline(iterationCap);
    }

    /**
     * Canonicalizes raw text using the configured formatting mode.
     *
     * @param raw untrusted input, null is treated as empty
     * @param renderMode how much structure to repair
     * @return canonical text
     */
    public CanonicalText canonicalize(String raw, RenderMode renderMode) {
        return canonicalize(raw, renderMode, defaultFormattingMode, DEFAULT_CONTEXT).text();
    }

    /**
     * Canonicalizes raw text and reports any leaked marker that had to be stripped.
     *
     * @param raw untrusted input, null is treated as empty
     * @param renderMode how much structure to repair
     * @param formattingMode whether a leaked marker fails the call
     * @param context label for the field, used in diagnostics and log lines
     * @return canonical text with diagnostics
     * @throws ContractViolationException when a marker leaked in strict mode
     */
    public FormattingResult canonicalize(
            String raw, RenderMode renderMode, FormattingMode formattingMode, String context) {
        Objects.requireNonNull(renderMode, "Render mode is required");
        Objects.requireNonNull(formattingMode, "Formatting mode is required");
        String scrubbed = LeakGuard.scrubReservedMarkers(raw == null ? "" : raw);
        String output = switch (renderMode) {
            case TITLE -> collapseToSingleLine(scrubbed);
            case PROSE -> joinProseLines(scrubbed);
            case EQUATION -> formatEquationToFixpoint(scrubbed, context);
        };
        logger.debug("Canonicalized {} chars of {} as {} ({} chars)",
                scrubbed.length(), context, renderMode.token(), output.length());
        return LeakGuard.finalizeText(output, renderMode, formattingMode, context == null ? "" : context);
    }

    public CanonicalText formatTitle(String raw) {
        return canonicalize(raw, RenderMode.TITLE);
    }

    public CanonicalText formatProse(String raw) {
        return canonicalize(raw, RenderMode.PROSE);
    }

    public CanonicalText formatEquation(String raw) {
        return canonicalize(raw, RenderMode.EQUATION);
    }

    /**
     * Minimal formatter for a single expression shown as a display row: fixes notation and joins
     * wrapped lines without running step or list segmentation. Arrows are dropped.
     */
    public String formatEquationText(String raw) {
        String scrubbed = LeakGuard.scrubReservedMarkers(raw == null ? "" : raw);
        if (scrubbed.isBlank()) {
            return "";
        }
        MaskArena arena = new MaskArena();
        String result = normalizeForEquationBlock(arena.maskAll(scrubbed, ContentPipeline.IMAGE_REFERENCE));
        result = FractionNormalizer.normalizeAdjacentFractions(result);
        result = ARROW_WITH_SPACING.matcher(result).replaceAll(" ");
        result = DIGIT_UNDERSCORE_PAREN.matcher(result).replaceAll("$1)");
        result = DIGIT_UNDERSCORE_OPERATOR.matcher(result).replaceAll("$1 $2");
        result = DIGIT_UNDERSCORE_SPACE.matcher(result).replaceAll("$1 ");
        return arena.restore(MULTI_WHITESPACE.matcher(result).replaceAll(" ").trim());
    }

    /**
     * Prepares a raw step block for equation extraction: one logical equation per line, labels
     * on their own lines, fractions in brace form.
     */
    public String normalizeEquationBlockForExtraction(String raw) {
        String scrubbed = LeakGuard.scrubReservedMarkers(raw == null ? "" : raw);
        if (scrubbed.isBlank()) {
            return "";
        }
        MaskArena arena = new MaskArena();
        String result = normalizeForEquationBlock(arena.maskAll(scrubbed, ContentPipeline.IMAGE_REFERENCE));
        return arena.restore(result).trim();
    }

    /**
     * Formats text according to its detected kind without running the full pipeline.
     */
    public String formatByKind(String raw, ContentKind kind) {
        Objects.requireNonNull(kind, "Content kind is required");
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return switch (kind) {
            case CODE -> formatCode(raw);
            case MATH -> formatEquationText(raw);
            case LIST -> {
                String list = TRAILING_LINE_SPACE.matcher(LeakGuard.scrubReservedMarkers(raw)).replaceAll("");
                yield EXCESS_BLANK_LINES.matcher(list).replaceAll("\n\n").trim();
            }
            case PROSE -> {
                String prose = SPACE_BEFORE_NEWLINE.matcher(LeakGuard.scrubReservedMarkers(raw)).replaceAll("\n");
                yield HORIZONTAL_SPACE_RUN.matcher(prose).replaceAll(" ").trim();
            }
        };
    }

    /**
     * Returns code exactly as written apart from removing internal markers, so indentation and
     * line structure survive.
     */
    public String formatCode(String raw) {
        return LeakGuard.stripReservedMarkersKeepingLayout(raw);
    }

    /**
     * Detects the kind of a content field.
     */
    public ContentKind detectContentKind(String raw) {
        return ContentKindDetector.detect(raw);
    }

    /**
     * Removes every internal marker and repairs the spacing around where it stood.
     */
    public String stripInternalArtifacts(String raw) {
        return LeakGuard.scrubReservedMarkers(raw);
    }

    private String normalizeForEquationBlock(String scrubbed) {
        String result = DelimiterNormalizer.normalizeLineBreaks(scrubbed);
        result = NotationDisambiguator.disambiguateAsterisks(result);
        result = FractionNormalizer.normalizeFractionForms(result);
        result = LabelIsolator.isolateLabels(result);
        result = FractionNormalizer.normalizeFractionWhitespace(result);
        result = FractionNormalizer.normalizeFractionMultiplication(result);
        result = DelimiterNormalizer.removeNewlinesInsideDelimiters(result);
        return LineJoiner.joinBrokenEquationLines(result);
    }

    private String formatEquationToFixpoint(String scrubbed, String context) {
        if (scrubbed.isBlank()) {
            return "";
        }
        String firstPass = pipeline.formatEquationOnce(scrubbed);
        return BoundedRewrite.untilStable(
                firstPass, pipeline::formatEquationOnce, iterationCap, "equation formatting of " + context).text();
    }

    private static String collapseToSingleLine(String scrubbed) {
        String normalized = DelimiterNormalizer.normalizeLineBreaks(scrubbed);
        return WHITESPACE_RUN.matcher(normalized).replaceAll(" ").trim();
    }

    private static String joinProseLines(String scrubbed) {
        String normalized = DelimiterNormalizer.normalizeLineBreaks(scrubbed);
        String joined = PROSE_LINE_BREAK.matcher(normalized).replaceAll(" ");
        return HORIZONTAL_SPACE_RUN.matcher(joined).replaceAll(" ").trim();
    }
}
