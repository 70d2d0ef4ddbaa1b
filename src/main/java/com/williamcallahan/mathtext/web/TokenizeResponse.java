package com.williamcallahan.mathtext.web;

import com.williamcallahan.mathtext.domain.formatting.InlineElement;
import com.williamcallahan.mathtext.domain.formatting.RenderMode;
import java.util.List;

/**
 * Canonical text and its inline elements, one list per line.
 *
 * @param text canonical text that was tokenized
 * @param mode render mode applied
 * @param lines inline elements per line
 */
public record TokenizeResponse(String text, RenderMode mode, List<List<InlineElement>> lines) {}
