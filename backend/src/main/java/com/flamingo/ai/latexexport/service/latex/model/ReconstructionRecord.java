package com.flamingo.ai.latexexport.service.latex.model;

/**
 * Replacement computed for one {@link MathNode} during the mark phase.
 *
 * @param nodeId id of the node this record replaces
 * @param replacementId value written to the node's {@code data-replacement-id} attribute
 * @param replacementText wrapped, HTML-escaped LaTeX that replaces the node on commit
 * @param sourcePositionHint position in scan order; diagnostics only, never used for commit order
 */
public record ReconstructionRecord(
    int nodeId, String replacementId, String replacementText, int sourcePositionHint) {}
