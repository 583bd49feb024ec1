package com.flamingo.ai.latexexport.service.latex.preprocess;

import java.util.List;

/**
 * Outcome of the delimiter balance check.
 *
 * @param valid {@code true} when no issue was found
 * @param issues human-readable issue descriptions
 */
public record SyntaxValidationResult(boolean valid, List<String> issues) {

  public SyntaxValidationResult {
    issues = List.copyOf(issues);
  }

  public static SyntaxValidationResult of(List<String> issues) {
    return new SyntaxValidationResult(issues.isEmpty(), issues);
  }
}
