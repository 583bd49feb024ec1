package com.flamingo.ai.latexexport.service.latex.model;

/**
 * LaTeX text wrapped in its delimiters or environment.
 *
 * @param text the wrapped LaTeX, e.g. {@code \(x+1\)}
 * @param source the resolution rule that chose the wrapper
 */
public record WrappedLatex(String text, EnvironmentSource source) {

  public boolean isHeuristic() {
    return source == EnvironmentSource.ALIGN_HEURISTIC
        || source == EnvironmentSource.GATHER_HEURISTIC;
  }
}
