package com.flamingo.ai.latexexport.service.latex.semantic;

import com.flamingo.ai.latexexport.service.latex.model.SemanticNode;
import com.flamingo.ai.latexexport.service.latex.model.SemanticNodeKind;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts a MathML semantic tree into LaTeX when a node carries no source annotation.
 *
 * <p>Recursive descent over {@link SemanticNodeKind}. Covers the constructs produced for ordinary
 * expressions (rows, tokens, scripts, fractions, roots). Anything else contributes its raw text and
 * is reported as unhandled, so one unknown element never fails a whole expression.
 */
@Component
@Slf4j
public class SemanticMathConverter {

  static final String INVISIBLE_TIMES = "\u2062";
  static final String EMPTY_SET = "\u2205";

  /**
   * Converts the tree, logging a warning for each unhandled element.
   *
   * @param semanticTree root of the tree, usually a {@code <math>} element; may be {@code null}
   * @return LaTeX text, empty for a {@code null} tree
   */
  public String convert(SemanticNode semanticTree) {
    return convertWithDiagnostics(semanticTree).latex();
  }

  /** Converts the tree and returns the unhandled tag names alongside the LaTeX. */
  public SemanticConversion convertWithDiagnostics(SemanticNode semanticTree) {
    List<String> unhandled = new ArrayList<>();
    String latex = convertNode(semanticTree, unhandled);
    if (!unhandled.isEmpty()) {
      log.debug("Semantic conversion fell back to raw text for {} element(s)", unhandled.size());
    }
    return new SemanticConversion(latex, unhandled);
  }

  private String convertNode(SemanticNode node, List<String> unhandled) {
    if (node == null) {
      return "";
    }
    return switch (node.kind()) {
      case MATH, ROW -> concatChildren(node, unhandled);
      case IDENTIFIER, NUMBER -> node.text();
      case TEXT -> "\\text{" + node.text() + "}";
      case OPERATOR -> convertOperator(node.text());
      case SUPERSCRIPT -> script(node, "^", unhandled);
      case SUBSCRIPT -> script(node, "_", unhandled);
      case FRACTION ->
          "\\frac{"
              + convertNode(node.child(0), unhandled)
              + "}{"
              + convertNode(node.child(1), unhandled)
              + "}";
      case SQUARE_ROOT -> "\\sqrt{" + concatChildren(node, unhandled) + "}";
      case ROOT ->
          "\\sqrt["
              + convertNode(node.child(1), unhandled)
              + "]{"
              + convertNode(node.child(0), unhandled)
              + "}";
      case SPACE -> " ";
      case UNKNOWN -> {
        log.warn("Unhandled MathML element: {}", node.tagName());
        unhandled.add(node.tagName());
        yield node.text();
      }
    };
  }

  private String script(SemanticNode node, String marker, List<String> unhandled) {
    return convertNode(node.child(0), unhandled)
        + marker
        + "{"
        + convertNode(node.child(1), unhandled)
        + "}";
  }

  private String concatChildren(SemanticNode node, List<String> unhandled) {
    StringBuilder sb = new StringBuilder();
    for (SemanticNode child : node.children()) {
      sb.append(convertNode(child, unhandled));
    }
    return sb.toString();
  }

  private String convertOperator(String op) {
    if (INVISIBLE_TIMES.equals(op)) {
      return "";
    }
    if (EMPTY_SET.equals(op)) {
      return "\\varnothing";
    }
    return op;
  }
}
