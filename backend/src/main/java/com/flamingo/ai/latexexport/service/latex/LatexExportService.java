package com.flamingo.ai.latexexport.service.latex;

import org.jsoup.nodes.Element;

/**
 * Converts documents containing MathJax-rendered math back into LaTeX source for export.
 *
 * <p>Every rendered expression is replaced by its LaTeX, wrapped in the delimiters or environment
 * it most likely came from, in original document order. Callers get either the fully reconstructed
 * document or, if anything fails, their original input unchanged; never a partial result.
 *
 * <p>Implementations are stateless: each call owns the tree it works on, so concurrent calls are
 * safe. A call cannot be cancelled once started; callers that no longer want the result discard it.
 */
public interface LatexExportService {

  /**
   * Reconstructs LaTeX in HTML export content.
   *
   * @param content export HTML containing rendered math
   * @return reconstructed HTML, or {@code content} unchanged on failure
   */
  String process(String content);

  /**
   * Reconstructs LaTeX using the caller's already-rendered tree when one is available.
   *
   * <p>Walking a clone of the live tree preserves true document order, where re-parsing the
   * serialized document can reorder large documents. The live tree is cloned and never modified.
   *
   * @param content export HTML, used when no live output element can be found
   * @param liveTree rendered tree containing the output element, may be {@code null}
   * @return reconstructed HTML (the processed output element in live mode), or {@code content}
   *     unchanged on failure
   */
  String process(String content, Element liveTree);

  /** Same as {@link #process(String, Element)}, also returning the run statistics. */
  ExportResult processWithReport(String content, Element liveTree);
}
