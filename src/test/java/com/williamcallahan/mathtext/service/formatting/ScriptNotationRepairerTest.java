package com.williamcallahan.mathtext.service.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests Unicode script conversion and closing of open scripts.
 */
class ScriptNotationRepairerTest {

    @Test
    void convertUnicodeScripts_rewritesSuperAndSubscripts() {
        assertEquals("x^2^ + H_2_O", ScriptNotationRepairer.convertUnicodeScripts("x² + H₂O"));
    }

    @Test
    void closeUnclosedScripts_closesOpenSuperscript() {
        assertEquals("x^2^ + 1", ScriptNotationRepairer.closeUnclosedScripts("x^2 + 1"));
        assertEquals("e^-1^", ScriptNotationRepairer.closeUnclosedScripts("e^(-1)"));
    }

    @Test
    void closeUnclosedScripts_closesOpenSubscript() {
        assertEquals("v_initial_ = 5", ScriptNotationRepairer.closeUnclosedScripts("v_initial = 5"));
    }

    @Test
    void closeUnclosedScripts_leavesClosedScriptsAlone() {
        assertEquals("x^2^", ScriptNotationRepairer.closeUnclosedScripts("x^2^"));
        assertEquals("v_0_ = 3", ScriptNotationRepairer.closeUnclosedScripts("v_0_ = 3"));
    }
}
