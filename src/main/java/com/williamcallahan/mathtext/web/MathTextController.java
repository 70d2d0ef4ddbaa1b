package com.williamcallahan.mathtext.web;

import com.williamcallahan.mathtext.config.AppProperties;
import com.williamcallahan.mathtext.domain.equation.EquationExtraction;
import com.williamcallahan.mathtext.domain.equation.StepActionClassification;
import com.williamcallahan.mathtext.domain.errors.ApiErrorResponse;
import com.williamcallahan.mathtext.domain.formatting.CanonicalText;
import com.williamcallahan.mathtext.domain.formatting.FormattingMode;
import com.williamcallahan.mathtext.domain.formatting.FormattingResult;
import com.williamcallahan.mathtext.domain.formatting.RenderMode;
import com.williamcallahan.mathtext.domain.solution.FormattedSolution;
import com.williamcallahan.mathtext.domain.solution.RawSolution;
import com.williamcallahan.mathtext.domain.solution.RawSolutionStep;
import com.williamcallahan.mathtext.service.equation.EquationExtractor;
import com.williamcallahan.mathtext.service.equation.StepActionClassifier;
import com.williamcallahan.mathtext.service.formatting.ContractViolationException;
import com.williamcallahan.mathtext.service.formatting.MathContentCanonicalizer;
import com.williamcallahan.mathtext.service.inline.InlineTokenizer;
import com.williamcallahan.mathtext.service.solution.SolutionFormatter;
import jakarta.validation.Valid;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints over the math text core: canonicalization, tokenizing, equation extraction,
 * step classification and whole-solution formatting.
 */
@RestController
@RequestMapping("/api/mathtext")
public class MathTextController extends BaseController {
    private static final Logger logger = LoggerFactory.getLogger(MathTextController.class);

    private final MathContentCanonicalizer canonicalizer;
    private final SolutionFormatter solutionFormatter;
    private final AppProperties appProperties;

    public MathTextController(
            MathContentCanonicalizer canonicalizer,
            SolutionFormatter solutionFormatter,
            AppProperties appProperties,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.canonicalizer = canonicalizer;
        this.solutionFormatter = solutionFormatter;
        this.appProperties = appProperties;
    }

    /**
     * Canonicalizes text in the requested mode.
     *
     * @param request text, mode token and optional strict flag
     * @return canonical text plus diagnostics for any marker that had to be stripped
     */
    @PostMapping(value = "/canonicalize",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CanonicalizeResponse> canonicalize(@Valid @RequestBody CanonicalizeRequest request) {
        requireWithinLimit(request.text(), "text");
        RenderMode renderMode = parseMode(request.mode());
        FormattingResult result = canonicalizer.canonicalize(
            request.text(), renderMode, resolveFormattingMode(request.strict()), "request");
        logger.debug("Canonicalize request: {} chars as {}", request.text().length(), renderMode.token());
        return ResponseEntity.ok(new CanonicalizeResponse(result.text().value(), renderMode, result.diagnostics()));
    }

    /**
     * Canonicalizes text and splits every line into typed inline elements.
     */
    @PostMapping(value = "/tokenize",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TokenizeResponse> tokenize(@Valid @RequestBody TokenizeRequest request) {
        requireWithinLimit(request.text(), "text");
        RenderMode renderMode = request.mode() == null ? RenderMode.EQUATION : parseMode(request.mode());
        CanonicalText canonical = canonicalizer.canonicalize(request.text(), renderMode);
        return ResponseEntity.ok(new TokenizeResponse(
            canonical.value(), renderMode, InlineTokenizer.tokenize(canonical)));
    }

    /**
     * Extracts equations from a step block after equation-mode canonicalization.
     */
    @PostMapping(value = "/equations",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EquationsResponse> equations(@Valid @RequestBody TextRequest request) {
        requireWithinLimit(request.text(), "text");
        String canonical = canonicalizer.formatEquation(request.text()).value();
        EquationExtraction extraction = EquationExtractor.extract(canonical);
        return ResponseEntity.ok(new EquationsResponse(
            extraction.equations(),
            EquationExtractor.extractFinalEquation(canonical).orElse(null),
            extraction.contentRows()));
    }

    @PostMapping(value = "/classify",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StepActionClassification> classify(@Valid @RequestBody TextRequest request) {
        requireWithinLimit(request.text(), "text");
        return ResponseEntity.ok(StepActionClassifier.classify(request.text()));
    }

    /**
     * Formats every field of a generated solution.
     */
    @PostMapping(value = "/solutions/format",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FormattedSolution> formatSolution(@Valid @RequestBody RawSolution solution) {
        requireWithinLimit(solution.problem(), "problem");
        for (RawSolutionStep step : solution.steps()) {
            requireWithinLimit(step.title(), "step title");
            requireWithinLimit(step.equation(), "step equation");
            requireWithinLimit(step.content(), "step content");
            requireWithinLimit(step.summary(), "step summary");
            requireWithinLimit(step.explanation(), "step explanation");
        }
        FormattedSolution formatted = solutionFormatter.format(solution);
        logger.debug("Formatted solution with {} steps", formatted.steps().size());
        return ResponseEntity.ok(formatted);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException e) {
        return super.handleValidationException(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getAllErrors().stream()
            .map(error -> error.getDefaultMessage() == null ? error.toString() : error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid request: " + details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(ContractViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleContractViolation(ContractViolationException e) {
        logger.error("Formatted output leaked an internal marker", e);
        return handleServiceException(e, "format text without leaking internal markers");
    }

    private RenderMode parseMode(String token) {
        return RenderMode.fromToken(token)
            .orElseThrow(() -> new IllegalArgumentException(
                String.format(Locale.ROOT, "Unknown mode '%s'; expected title, prose or equation", token)));
    }

    private FormattingMode resolveFormattingMode(Boolean strict) {
        if (strict == null) {
            return FormattingMode.of(appProperties.getFormatting().isStrict());
        }
        return FormattingMode.of(strict);
    }

    private void requireWithinLimit(String text, String field) {
        int limit = appProperties.getFormatting().getMaxInputLength();
        if (text != null && text.length() > limit) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "%s exceeds the maximum length of %d characters", field, limit));
        }
    }
}
