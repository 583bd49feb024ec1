package com.flamingo.ai.latexexport.service.latex.model;

/** How the node scanner obtains the tree it walks. */
public enum ScanMode {
  /** The export content is parsed into an offline tree. */
  STATIC,
  /** A clone of the caller's already-rendered tree is walked directly, preserving its order. */
  LIVE
}
