package com.williamcallahan.mathtext.config;

import java.util.Locale;

/**
 * Formatting pipeline configuration bound from {@code app.formatting.*}.
 */
public class FormattingConfig {

    private static final int ITERATION_CAP_DEF = 20;
    private static final int ITERATION_CAP_MAX = 1_000;
    private static final int MAX_INPUT_LENGTH_DEF = 100_000;
    private static final int MIN_POSITIVE = 1;
    private static final String ITERATION_CAP_KEY = "app.formatting.iteration-cap";
    private static final String MAX_INPUT_LENGTH_KEY = "app.formatting.max-input-length";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String AT_MOST_FMT = "%s must be at most %d.";

    private int iterationCap = ITERATION_CAP_DEF;
    private boolean strict;
    private int maxInputLength = MAX_INPUT_LENGTH_DEF;
    private boolean colorizeVariables;

    public FormattingConfig() {}

    /**
     * Validates formatting settings.
     */
    public void validateConfiguration() {
        if (iterationCap < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, ITERATION_CAP_KEY));
        }
        if (iterationCap > ITERATION_CAP_MAX) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, AT_MOST_FMT, ITERATION_CAP_KEY, ITERATION_CAP_MAX));
        }
        if (maxInputLength < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_INPUT_LENGTH_KEY));
        }
    }

    public int getIterationCap() {
        return iterationCap;
    }

    public void setIterationCap(final int iterationCap) {
        this.iterationCap = iterationCap;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(final boolean strict) {
        this.strict = strict;
    }

    public int getMaxInputLength() {
        return maxInputLength;
    }

    public void setMaxInputLength(final int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }

    public boolean isColorizeVariables() {
        return colorizeVariables;
    }

    public void setColorizeVariables(final boolean colorizeVariables) {
        this.colorizeVariables = colorizeVariables;
    }
}
