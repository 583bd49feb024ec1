package com.flamingo.ai.latexexport.exception;

/**
 * Exception thrown when a reconstruction run cannot complete.
 *
 * <p>Never escapes {@link com.flamingo.ai.latexexport.service.latex.LatexExportService}: the
 * orchestrator catches it and returns the caller's original content.
 */
public class MathReconstructionException extends RuntimeException {

  private final ReconstructionPhase phase;

  public MathReconstructionException(ReconstructionPhase phase, String message) {
    super(message);
    this.phase = phase;
  }

  public MathReconstructionException(ReconstructionPhase phase, String message, Throwable cause) {
    super(message, cause);
    this.phase = phase;
  }

  public ReconstructionPhase getPhase() {
    return phase;
  }
}
