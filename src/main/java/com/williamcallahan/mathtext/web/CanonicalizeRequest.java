package com.williamcallahan.mathtext.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for canonicalizing one piece of text.
 *
 * @param text raw text to canonicalize
 * @param mode render mode token: title, prose or equation
 * @param strict when true a leaked marker fails the request; null uses the configured default
 */
public record CanonicalizeRequest(
    @NotNull(message = "Text is required") String text,
    @NotBlank(message = "Mode is required") String mode,
    Boolean strict
) {}
