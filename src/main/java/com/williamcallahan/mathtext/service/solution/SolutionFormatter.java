package com.williamcallahan.mathtext.service.solution;

import com.williamcallahan.mathtext.config.AppProperties;
import com.williamcallahan.mathtext.domain.equation.Equation;
import com.williamcallahan.mathtext.domain.equation.EquationExtraction;
import com.williamcallahan.mathtext.domain.equation.StepActionClassification;
import com.williamcallahan.mathtext.domain.formatting.ContentKind;
import com.williamcallahan.mathtext.domain.formatting.FormattingDiagnostic;
import com.williamcallahan.mathtext.domain.formatting.FormattingMode;
import com.williamcallahan.mathtext.domain.formatting.FormattingResult;
import com.williamcallahan.mathtext.domain.formatting.HighlightColor;
import com.williamcallahan.mathtext.domain.formatting.RenderMode;
import com.williamcallahan.mathtext.domain.solution.FinalAnswer;
import com.williamcallahan.mathtext.domain.solution.FormattedSolution;
import com.williamcallahan.mathtext.domain.solution.FormattedSolutionStep;
import com.williamcallahan.mathtext.domain.solution.RawSolution;
import com.williamcallahan.mathtext.domain.solution.RawSolutionStep;
import com.williamcallahan.mathtext.service.equation.EquationExtractor;
import com.williamcallahan.mathtext.service.equation.StepActionClassifier;
import com.williamcallahan.mathtext.service.formatting.MathContentCanonicalizer;
import com.williamcallahan.mathtext.service.formatting.VariableColorizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Formats every user-visible field of a generated solution.
 *
 * <p>Each field is routed to the render mode that suits its detected content kind, steps are
 * classified and their equations extracted, and leak diagnostics from all fields are gathered
 * into one list. When variable colorizing is enabled a single color map covers the whole
 * solution so a variable keeps its color from step to step.</p>
 */
@Service
public class SolutionFormatter {
    private static final Logger logger = LoggerFactory.getLogger(SolutionFormatter.class);

    private final MathContentCanonicalizer canonicalizer;
    private final AppProperties appProperties;

    public SolutionFormatter(MathContentCanonicalizer canonicalizer, AppProperties appProperties) {
        this.canonicalizer = canonicalizer;
        this.appProperties = appProperties;
    }

    /**
     * Formats a solution using the configured formatting mode.
     */
    public FormattedSolution format(RawSolution raw) {
        return format(raw, FormattingMode.of(appProperties.getFormatting().isStrict()));
    }

    /**
     * Formats a solution.
     *
     * @param raw validated raw solution
     * @param formattingMode whether a leaked marker in any field fails the call
     * @return the formatted solution with diagnostics from every field
     */
    public FormattedSolution format(RawSolution raw, FormattingMode formattingMode) {
        Objects.requireNonNull(raw, "Solution is required");
        FieldFormatter fields = new FieldFormatter(formattingMode);

        String problem = fields.equation(raw.problem(), "problem");
        List<FormattedSolutionStep> steps = new ArrayList<>(raw.steps().size());
        for (int index = 0; index < raw.steps().size(); index++) {
            steps.add(formatStep(raw.steps().get(index), index + 1, fields));
        }
        FinalAnswer finalAnswer = raw.finalAnswer().map(answer -> fields.equation(answer, "finalAnswer"));

        FormattedSolution formatted = new FormattedSolution(problem, steps, finalAnswer, fields.diagnostics());
        if (appProperties.getFormatting().isColorizeVariables()) {
            formatted = colorize(formatted);
        }
        logger.debug("Formatted solution with {} steps and {} diagnostics",
            steps.size(), formatted.diagnostics().size());
        return formatted;
    }

    private FormattedSolutionStep formatStep(RawSolutionStep step, int position, FieldFormatter fields) {
        String prefix = "steps[" + position + "].";
        String title = fields.format(step.title(), RenderMode.TITLE, prefix + "title");

        ContentKind equationKind = kindOf(step.equation());
        String equation = formatEquationField(step.equation(), equationKind, prefix + "equation", fields);

        String content = fields.equation(step.content(), prefix + "content");

        ContentKind summaryKind = kindOf(step.summary());
        String summary = formatDescription(step.summary(), summaryKind, prefix + "summary", fields);
        ContentKind explanationKind = kindOf(step.explanation());
        String explanation = formatDescription(step.explanation(), explanationKind, prefix + "explanation", fields);

        StepActionClassification classification = StepActionClassifier.classify(actionText(title, summary));

        List<Equation> equations = List.of();
        Equation finalEquation = null;
        if (equation != null && equationKind != ContentKind.CODE) {
            EquationExtraction extraction = EquationExtractor.extract(equation);
            equations = extraction.equations();
            finalEquation = EquationExtractor.extractFinalEquation(equation).orElse(null);
        }

        return new FormattedSolutionStep(
            step.id(),
            title,
            equation,
            step.rawEquation(),
            equationKind,
            content,
            summary,
            summaryKind,
            explanation,
            explanationKind,
            classification.action(),
            classification.label(),
            classification.bothSidesOperation(),
            equations,
            finalEquation
        );
    }

    private String formatEquationField(String raw, ContentKind kind, String context, FieldFormatter fields) {
        if (raw == null) {
            return null;
        }
        return switch (kind) {
            case CODE -> canonicalizer.formatCode(raw);
            case LIST -> canonicalizer.formatByKind(raw, ContentKind.LIST);
            case MATH, PROSE -> fields.equation(raw, context);
        };
    }

    private String formatDescription(String raw, ContentKind kind, String context, FieldFormatter fields) {
        if (raw == null) {
            return null;
        }
        return switch (kind) {
            case CODE -> canonicalizer.formatCode(raw);
            case MATH, LIST -> fields.equation(raw, context);
            case PROSE -> fields.format(raw, RenderMode.PROSE, context);
        };
    }

    private FormattedSolution colorize(FormattedSolution formatted) {
        StringBuilder corpus = new StringBuilder();
        if (!isCode(formatted.problem())) {
            appendIfPresent(corpus, formatted.problem());
        }
        for (FormattedSolutionStep step : formatted.steps()) {
            appendIfPresent(corpus, step.title());
            if (step.equationKind() != ContentKind.CODE) {
                appendIfPresent(corpus, step.equation());
            }
            if (!isCode(step.content())) {
                appendIfPresent(corpus, step.content());
            }
            if (step.summaryKind() != ContentKind.CODE) {
                appendIfPresent(corpus, step.summary());
            }
            if (step.explanationKind() != ContentKind.CODE) {
                appendIfPresent(corpus, step.explanation());
            }
        }
        Map<String, HighlightColor> colorMap = VariableColorizer.buildColorMap(corpus.toString());
        if (colorMap.isEmpty()) {
            return formatted;
        }
        UnaryOperator<String> paint = text -> text == null ? null : VariableColorizer.applyColors(text, colorMap);
        UnaryOperator<String> paintUnlessCode = text -> isCode(text) ? text : paint.apply(text);

        List<FormattedSolutionStep> steps = new ArrayList<>(formatted.steps().size());
        for (FormattedSolutionStep step : formatted.steps()) {
            steps.add(new FormattedSolutionStep(
                step.id(),
                step.title(),
                step.equationKind() == ContentKind.CODE ? step.equation() : paint.apply(step.equation()),
                step.rawEquation(),
                step.equationKind(),
                paintUnlessCode.apply(step.content()),
                step.summaryKind() == ContentKind.CODE ? step.summary() : paint.apply(step.summary()),
                step.summaryKind(),
                step.explanationKind() == ContentKind.CODE ? step.explanation() : paint.apply(step.explanation()),
                step.explanationKind(),
                step.action(),
                step.actionLabel(),
                step.bothSidesOperation(),
                step.equations(),
                step.finalEquation()
            ));
        }
        logger.debug("Colorized {} variables", colorMap.size());
        return new FormattedSolution(
            paintUnlessCode.apply(formatted.problem()),
            steps,
            formatted.finalAnswer().map(paintUnlessCode),
            formatted.diagnostics()
        );
    }

    private ContentKind kindOf(String raw) {
        return raw == null ? null : canonicalizer.detectContentKind(raw);
    }

    private boolean isCode(String raw) {
        return raw != null && canonicalizer.detectContentKind(raw) == ContentKind.CODE;
    }

    private static String actionText(String title, String summary) {
        return summary == null ? title : title + " " + summary;
    }

    private static void appendIfPresent(StringBuilder corpus, String text) {
        if (text != null) {
            corpus.append('\n').append(text);
        }
    }

    /**
     * Per-call helper that canonicalizes fields and keeps their diagnostics.
     */
    private final class FieldFormatter {
        private final FormattingMode formattingMode;
        private final List<FormattingDiagnostic> diagnostics = new ArrayList<>();

        private FieldFormatter(FormattingMode formattingMode) {
            this.formattingMode = Objects.requireNonNull(formattingMode, "Formatting mode is required");
        }

        /**
         * Equation-mode formatting. Code only loses reserved markers so its layout survives.
         */
        String equation(String raw, String context) {
            if (raw == null) {
                return null;
            }
            if (isCode(raw)) {
                return canonicalizer.formatCode(raw);
            }
            return format(raw, RenderMode.EQUATION, context);
        }

        String format(String raw, RenderMode renderMode, String context) {
            FormattingResult result = canonicalizer.canonicalize(raw, renderMode, formattingMode, context);
            diagnostics.addAll(result.diagnostics());
            return result.text().value();
        }

        List<FormattingDiagnostic> diagnostics() {
            return diagnostics;
        }
    }
}
