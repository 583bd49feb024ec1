package com.flamingo.ai.latexexport.exception;

/** Stage of the reconstruction pipeline in which a pipeline-wide failure occurred. */
public enum ReconstructionPhase {
  CLONE,
  SCAN,
  MARK,
  COMMIT,
  POST_PROCESS
}
