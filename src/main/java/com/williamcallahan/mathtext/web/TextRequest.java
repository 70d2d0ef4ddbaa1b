package com.williamcallahan.mathtext.web;

import jakarta.validation.constraints.NotNull;

/**
 * Request body carrying a single piece of text.
 *
 * @param text the text to process
 */
public record TextRequest(@NotNull(message = "Text is required") String text) {}
