package com.williamcallahan.mathtext.web;

import com.williamcallahan.mathtext.domain.errors.ApiErrorResponse;
import com.williamcallahan.mathtext.domain.formatting.FormattingDiagnostic;
import com.williamcallahan.mathtext.service.formatting.ContractViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Describes an exception for clients. A leaked-marker failure names the marker, the leaked
     * text and the field it was found in.
     *
     * @param exception exception to describe
     * @return formatted details or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        if (exception instanceof ContractViolationException violation) {
            FormattingDiagnostic diagnostic = violation.getDiagnostic();
            return String.format("%s (marker=%s, token=%s, context=%s)",
                exception.getMessage(), diagnostic.marker(), diagnostic.token(), diagnostic.context());
        }
        return exception.getMessage();
    }
}
