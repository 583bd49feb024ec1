package com.flamingo.ai.latexexport.service.latex.model;

/** Which rule of the environment resolver produced a {@link WrappedLatex}. */
public enum EnvironmentSource {
  STORED_HINT,
  ALREADY_WRAPPED,
  ALIGN_HEURISTIC,
  GATHER_HEURISTIC,
  DISPLAY,
  INLINE
}
