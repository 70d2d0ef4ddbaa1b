package com.williamcallahan.mathtext.web;

import com.williamcallahan.mathtext.domain.equation.Equation;
import java.util.List;

/**
 * Equations extracted from a step block.
 *
 * @param equations unique equations in first-seen order
 * @param finalEquation the most final equation, null when none was found
 * @param contentRows non-noise lines that held no equation
 */
public record EquationsResponse(List<Equation> equations, Equation finalEquation, List<String> contentRows) {}
