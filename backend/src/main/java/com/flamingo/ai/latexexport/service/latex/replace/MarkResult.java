package com.flamingo.ai.latexexport.service.latex.replace;

import com.flamingo.ai.latexexport.service.latex.model.ReconstructionRecord;
import java.util.List;

/**
 * Outcome of the mark phase.
 *
 * @param markerId run-scoped prefix shared by every {@code data-replacement-id} of this run
 * @param records one record per marked node, in scan order
 * @param semanticFallbacks nodes reconstructed from their semantic tree
 * @param unconvertible nodes left untouched because no usable LaTeX could be recovered
 */
public record MarkResult(
    String markerId, List<ReconstructionRecord> records, int semanticFallbacks, int unconvertible) {

  public MarkResult {
    records = List.copyOf(records);
  }
}
