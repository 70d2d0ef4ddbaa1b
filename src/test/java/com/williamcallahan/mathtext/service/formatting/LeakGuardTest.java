package com.williamcallahan.mathtext.service.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mathtext.domain.formatting.FormattingDiagnostic;
import com.williamcallahan.mathtext.domain.formatting.FormattingMode;
import com.williamcallahan.mathtext.domain.formatting.FormattingResult;
import com.williamcallahan.mathtext.domain.formatting.RenderMode;
import com.williamcallahan.mathtext.domain.formatting.ReservedMarker;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests marker scrubbing and the strict and lenient leak policies.
 */
class LeakGuardTest {

    @Test
    void scrubReservedMarkers_removesLegacyMarkersAndRepairsSpacing() {
        assertEquals("value here", LeakGuard.scrubReservedMarkers("value MASK12 here"));
        assertEquals("x y", LeakGuard.scrubReservedMarkers("x LIST_BREAK y"));
        assertEquals("a b", LeakGuard.scrubReservedMarkers("a ⟪STEP⟫b"));
    }

    @Test
    void scrubReservedMarkers_returnsCleanTextUnchanged() {
        String clean = "plain text  with spaces";

        assertEquals(clean, LeakGuard.scrubReservedMarkers(clean));
        assertEquals("", LeakGuard.scrubReservedMarkers(null));
    }

    @Test
    void stripReservedMarkersKeepingLayout_leavesWhitespaceAlone() {
        String code = "if (ok) {\n    x = " + MaskArena.keyFor(3) + "1;\n\ty = " + MaskArena.KEY_CLOSE + "2;\n}";

        assertEquals("if (ok) {\n    x = 1;\n\ty = 2;\n}", LeakGuard.stripReservedMarkersKeepingLayout(code));
    }

    @Test
    void scan_reportsNestedMatchOnce() {
        List<FormattingDiagnostic> diagnostics = LeakGuard.scan(MaskArena.keyFor(3), "field");

        assertEquals(1, diagnostics.size());
        assertEquals(ReservedMarker.MASK_KEY, diagnostics.get(0).marker());
    }

    @Test
    void finalizeText_strictModeThrowsOnLeak() {
        ContractViolationException exception = assertThrows(ContractViolationException.class,
                () -> LeakGuard.finalizeText("x MASK1 y", RenderMode.EQUATION, FormattingMode.STRICT, "field"));

        assertEquals(ReservedMarker.NUMBERED_MASK, exception.getDiagnostic().marker());
        assertEquals("field", exception.getDiagnostic().context());
    }

    @Test
    void finalizeText_lenientModeStripsAndReports() {
        FormattingResult result = LeakGuard.finalizeText(
                "x MASK1 y", RenderMode.EQUATION, FormattingMode.LENIENT, "field");

        assertEquals("x y", result.text().value());
        assertEquals(1, result.diagnostics().size());
        assertEquals(2, result.diagnostics().get(0).position());
        assertTrue(result.diagnostics().get(0).describe().contains("field"));
    }

    @Test
    void finalizeText_cleanTextHasNoDiagnostics() {
        FormattingResult result = LeakGuard.finalizeText("x = 5", RenderMode.EQUATION, FormattingMode.STRICT, "field");

        assertEquals("x = 5", result.text().value());
        assertTrue(result.diagnostics().isEmpty());
    }
}
