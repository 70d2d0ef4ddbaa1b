package com.williamcallahan.mathtext.web;

import jakarta.validation.constraints.NotNull;

/**
 * Request body for tokenizing text into inline elements.
 *
 * @param text raw text, canonicalized before tokenizing
 * @param mode optional render mode token, equation when absent
 */
public record TokenizeRequest(@NotNull(message = "Text is required") String text, String mode) {}
