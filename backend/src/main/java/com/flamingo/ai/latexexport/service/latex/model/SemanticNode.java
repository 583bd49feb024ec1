package com.flamingo.ai.latexexport.service.latex.model;

import java.util.Arrays;
import java.util.List;

/**
 * Read-only snapshot of one MathML element, detached from the document tree.
 *
 * @param kind the element kind
 * @param tagName the original tag name, kept for diagnostics on {@link SemanticNodeKind#UNKNOWN}
 * @param text the element's trimmed text content (all descendants)
 * @param children element children in document order
 */
public record SemanticNode(
    SemanticNodeKind kind, String tagName, String text, List<SemanticNode> children) {

  public SemanticNode {
    text = text == null ? "" : text;
    children = children == null ? List.of() : List.copyOf(children);
  }

  /** Leaf node such as {@code <mi>a</mi>}. */
  public static SemanticNode leaf(SemanticNodeKind kind, String text) {
    return new SemanticNode(kind, kind.tagName(), text, List.of());
  }

  /** Composite node; its text is the concatenation of its children's text. */
  public static SemanticNode of(SemanticNodeKind kind, SemanticNode... children) {
    StringBuilder text = new StringBuilder();
    for (SemanticNode child : children) {
      text.append(child.text());
    }
    return new SemanticNode(kind, kind.tagName(), text.toString(), Arrays.asList(children));
  }

  /** Child at {@code index}, or {@code null} when the element has fewer children. */
  public SemanticNode child(int index) {
    return index < children.size() ? children.get(index) : null;
  }
}
