package com.williamcallahan.mathtext.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mathtext.domain.errors.ApiErrorResponse;
import com.williamcallahan.mathtext.domain.formatting.FormattingDiagnostic;
import com.williamcallahan.mathtext.domain.formatting.ReservedMarker;
import com.williamcallahan.mathtext.service.formatting.ContractViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies exception descriptions name the leaked marker when one is available.
 */
class ExceptionResponseBuilderTest {
    private static final String LEAKED_TOKEN = "MASK3";
    private static final String FIELD_CONTEXT = "step 2 equation";
    private static final String EXPECTED_MARKER_TOKEN = "marker=NUMBERED_MASK";
    private static final String EXPECTED_LEAK_TOKEN = "token=MASK3";
    private static final String EXPECTED_CONTEXT_TOKEN = "context=step 2 equation";

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_includesMarkerTokenAndContext() {
        ContractViolationException exception = new ContractViolationException(
                new FormattingDiagnostic(ReservedMarker.NUMBERED_MASK, LEAKED_TOKEN, 4, FIELD_CONTEXT));

        String details = builder.describeException(exception);

        assertTrue(details.contains(EXPECTED_MARKER_TOKEN), details);
        assertTrue(details.contains(EXPECTED_LEAK_TOKEN), details);
        assertTrue(details.contains(EXPECTED_CONTEXT_TOKEN), details);
    }

    @Test
    void describeException_usesMessageForOtherExceptions() {
        assertEquals("bad input", builder.describeException(new IllegalArgumentException("bad input")));
        assertNull(builder.describeException(null));
    }

    @Test
    void buildErrorResponse_carriesStatusMessageAndDetails() {
        ResponseEntity<ApiErrorResponse> response = builder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to format", new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        ApiErrorResponse body = response.getBody();
        assertEquals("error", body.status());
        assertEquals("Failed to format", body.message());
        assertEquals("boom", body.details());
    }

    @Test
    void buildErrorResponse_withoutExceptionHasNoDetails() {
        ResponseEntity<ApiErrorResponse> response =
                builder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertNull(response.getBody().details());
    }
}
