package com.williamcallahan.mathtext.service.formatting;

import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats a rewrite until the text stops changing or an iteration cap is reached.
 */
final class BoundedRewrite {
    private static final Logger logger = LoggerFactory.getLogger(BoundedRewrite.class);

    static final int DEFAULT_ITERATION_CAP = 20;

    private BoundedRewrite() {}

    /**
     * Result of a bounded rewrite loop.
     *
     * @param text final text
     * @param iterations rewrites that changed the text
     * @param converged whether a fixpoint was reached before the cap
     */
    record Outcome(String text, int iterations, boolean converged) {
    }

    /**
     * Applies the rewrite until its output equals its input. Hitting the cap is not an error: the
     * last text is returned and a warning names the rewrite.
     *
     * @param rewriteName what the rewrite does, for the warning
     */
    static Outcome untilStable(String input, UnaryOperator<String> rewrite, int iterationCap, String rewriteName) {
        String current = input;
        for (int iteration = 0; iteration < iterationCap; iteration++) {
            String next = rewrite.apply(current);
            if (next.equals(current)) {
                return new Outcome(current, iteration, true);
            }
            current = next;
        }
        logger.warn("{} did not stabilize within {} passes", rewriteName, iterationCap);
        return new Outcome(current, iterationCap, false);
    }
}
