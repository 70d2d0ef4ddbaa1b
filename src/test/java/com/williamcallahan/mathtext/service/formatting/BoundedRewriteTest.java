package com.williamcallahan.mathtext.service.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Verifies the fixpoint loop stops on a stable text or at its cap.
 */
class BoundedRewriteTest {
    private final Logger rewriteLogger = (Logger) LoggerFactory.getLogger(BoundedRewrite.class);
    private final ListAppender<ILoggingEvent> logEvents = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        logEvents.start();
        rewriteLogger.addAppender(logEvents);
    }

    @AfterEach
    void detachAppender() {
        rewriteLogger.detachAppender(logEvents);
        logEvents.stop();
    }

    @Test
    void untilStable_stopsAtFixpoint() {
        BoundedRewrite.Outcome outcome = BoundedRewrite.untilStable(
                "aaa", text -> text.length() > 1 ? text.substring(1) : text, 20, "trimming");

        assertEquals("a", outcome.text());
        assertEquals(2, outcome.iterations());
        assertTrue(outcome.converged());
        assertTrue(logEvents.list.isEmpty());
    }

    @Test
    void untilStable_returnsLastTextWhenCapReached() {
        BoundedRewrite.Outcome outcome = BoundedRewrite.untilStable("abc", text -> text + "x", 5, "appending");

        assertEquals("abcxxxxx", outcome.text());
        assertEquals(5, outcome.iterations());
        assertFalse(outcome.converged());
    }

    @Test
    void untilStable_warnsWhenCapReached() {
        BoundedRewrite.untilStable("abc", text -> text + "x", 3, "appending");

        assertEquals(1, logEvents.list.size());
        ILoggingEvent event = logEvents.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertEquals("appending did not stabilize within 3 passes", event.getFormattedMessage());
    }

    @Test
    void untilStable_reportsZeroIterationsForStableInput() {
        BoundedRewrite.Outcome outcome = BoundedRewrite.untilStable("x = 5", String::trim, 3, "trimming");

        assertEquals("x = 5", outcome.text());
        assertEquals(0, outcome.iterations());
        assertTrue(outcome.converged());
    }
}
