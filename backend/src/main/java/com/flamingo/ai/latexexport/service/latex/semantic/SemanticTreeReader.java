package com.flamingo.ai.latexexport.service.latex.semantic;

import com.flamingo.ai.latexexport.service.latex.model.SemanticNode;
import com.flamingo.ai.latexexport.service.latex.model.SemanticNodeKind;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/** Snapshots a MathML subtree of the document into an immutable {@link SemanticNode} tree. */
@Component
public class SemanticTreeReader {

  public SemanticNode read(Element element) {
    if (element == null) {
      return null;
    }
    List<SemanticNode> children = new ArrayList<>();
    for (Element child : element.children()) {
      children.add(read(child));
    }
    return new SemanticNode(
        SemanticNodeKind.fromTag(element.normalName()),
        element.normalName(),
        element.text().trim(),
        children);
  }
}
