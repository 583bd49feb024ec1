package com.flamingo.ai.latexexport.service.latex.model;

import org.jsoup.nodes.Element;

/**
 * One rendered math expression found by the node scanner.
 *
 * <p>{@code element} is a borrowed view into the tree owned by the running export; only the
 * mark-and-replace engine may change it.
 *
 * @param id identity within one run, equal to the node's position in scan order
 * @param element the rendered container element
 * @param display {@code true} for block math, {@code false} for inline math
 * @param annotation original LaTeX source from the embedded annotation, or {@code null}
 * @param semanticTree MathML snapshot used when {@code annotation} is absent, or {@code null}
 * @param environmentHint environment name stored by an upstream stage, or {@code null}
 * @param protectedRegion {@code true} when the node lies in a region reserved for another pipeline
 */
public record MathNode(
    int id,
    Element element,
    boolean display,
    String annotation,
    SemanticNode semanticTree,
    String environmentHint,
    boolean protectedRegion) {

  public boolean hasAnnotation() {
    return annotation != null && !annotation.isBlank();
  }

  public boolean hasSemanticTree() {
    return semanticTree != null;
  }
}
