package com.flamingo.ai.latexexport.service.latex.semantic;

import java.util.List;

/**
 * Result of converting a semantic tree, with the tags the converter could not interpret.
 *
 * @param latex converted LaTeX (never {@code null})
 * @param unhandledTags tag names that fell back to raw text, in encounter order
 */
public record SemanticConversion(String latex, List<String> unhandledTags) {

  public SemanticConversion {
    unhandledTags = List.copyOf(unhandledTags);
  }

  public boolean isLossless() {
    return unhandledTags.isEmpty();
  }
}
