package com.flamingo.ai.latexexport.service.latex.scan;

import com.flamingo.ai.latexexport.config.LatexExportConfig;
import com.flamingo.ai.latexexport.exception.MathReconstructionException;
import com.flamingo.ai.latexexport.exception.ReconstructionPhase;
import com.flamingo.ai.latexexport.service.latex.environment.EnvironmentResolver;
import com.flamingo.ai.latexexport.service.latex.model.MathNode;
import com.flamingo.ai.latexexport.service.latex.model.SemanticNode;
import com.flamingo.ai.latexexport.service.latex.semantic.SemanticTreeReader;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Collects the rendered math containers of an {@link ExportWorkspace} in document order.
 *
 * <p>For each container it reads:
 *
 * <ul>
 *   <li>the LaTeX annotation of the assistive MathML, trying each configured encoding in turn
 *   <li>a {@link SemanticNode} snapshot of that MathML when no annotation is present
 *   <li>the display flag ({@code display="true"} or an enclosing {@code span.math.display})
 *   <li>the stored environment name, from the container or else its parent
 * </ul>
 *
 * <p>Containers in a protected region (inside {@code [data-skip-latex-export=true]} or carrying
 * {@code data-tikz-math}) are never returned. Neither are containers nested in another container,
 * which are part of their ancestor's rendering.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MathNodeScanner {

  private final LatexExportConfig config;
  private final EnvironmentResolver environmentResolver;
  private final SemanticTreeReader semanticTreeReader;

  /**
   * Scans the workspace.
   *
   * @return unprotected math nodes in pre-order document order, ids {@code 0..n-1}
   * @throws MathReconstructionException if the tree cannot be scanned, e.g. for an invalid
   *     configured selector
   */
  public List<MathNode> scan(ExportWorkspace workspace) {
    try {
      return collect(workspace);
    } catch (MathReconstructionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new MathReconstructionException(
          ReconstructionPhase.SCAN, "Failed to scan math containers: " + e.getMessage(), e);
    }
  }

  private List<MathNode> collect(ExportWorkspace workspace) {
    String containerTag = config.getScan().getContainerTag();
    List<Element> containers = workspace.root().select(containerTag);
    log.debug(
        "Found {} {} elements ({} mode)", containers.size(), containerTag, workspace.mode());

    List<MathNode> nodes = new ArrayList<>(containers.size());
    int protectedCount = 0;
    for (Element container : containers) {
      if (isNestedContainer(container, containerTag)) {
        log.debug("Skipping container nested inside another container");
        continue;
      }
      MathNode node = toMathNode(container, nodes.size());
      if (node.protectedRegion()) {
        protectedCount++;
        continue;
      }
      nodes.add(node);
    }

    if (protectedCount > 0) {
      log.debug("Skipped {} container(s) in protected regions", protectedCount);
    }
    return nodes;
  }

  /** Builds the node for one container; {@code id} is its position among returned nodes. */
  protected MathNode toMathNode(Element container, int id) {
    if (isProtected(container)) {
      return new MathNode(id, container, false, null, null, null, true);
    }

    Element mathMl = container.selectFirst(config.getScan().getAssistiveSelector());
    String annotation = mathMl != null ? findAnnotation(mathMl) : null;
    SemanticNode semanticTree =
        mathMl != null && annotation == null ? semanticTreeReader.read(mathMl) : null;

    return new MathNode(
        id,
        container,
        isDisplay(container),
        annotation,
        semanticTree,
        findEnvironmentHint(container),
        false);
  }

  private boolean isProtected(Element container) {
    LatexExportConfig.Scan scan = config.getScan();
    return container.hasAttr(scan.getProtectedAttribute())
        || container.closest(scan.getProtectedSelector()) != null;
  }

  private boolean isNestedContainer(Element container, String containerTag) {
    Element parent = container.parent();
    return parent != null && parent.closest(containerTag) != null;
  }

  private String findAnnotation(Element mathMl) {
    for (String encoding : config.getScan().getAnnotationEncodings()) {
      Element annotation = mathMl.selectFirst("annotation[encoding=\"" + encoding + "\"]");
      if (annotation != null) {
        String text = annotation.wholeText().trim();
        if (!text.isEmpty()) {
          return text;
        }
      }
    }
    return null;
  }

  private boolean isDisplay(Element container) {
    if ("true".equals(container.attr("display"))) {
      return true;
    }
    Element legacySpan = container.closest("span.math");
    return legacySpan != null && legacySpan.hasClass("display");
  }

  /**
   * Returns the first usable stored environment name on the container, then its parent. If only
   * malformed values exist the first one is returned so the resolver can report it.
   */
  private String findEnvironmentHint(Element container) {
    String malformed = null;
    Element[] candidates = {container, container.parent()};
    for (Element element : candidates) {
      if (element == null) {
        continue;
      }
      for (String attribute : config.getScan().getEnvironmentAttributes()) {
        String value = element.attr(attribute);
        if (value.isBlank()) {
          continue;
        }
        if (environmentResolver.isUsableHint(value)) {
          return value;
        }
        if (malformed == null) {
          malformed = value;
        }
      }
    }
    return malformed;
  }
}
