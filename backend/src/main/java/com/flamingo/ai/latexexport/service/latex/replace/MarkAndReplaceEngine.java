package com.flamingo.ai.latexexport.service.latex.replace;

import com.flamingo.ai.latexexport.config.LatexExportConfig;
import com.flamingo.ai.latexexport.exception.MathReconstructionException;
import com.flamingo.ai.latexexport.exception.ReconstructionPhase;
import com.flamingo.ai.latexexport.service.latex.environment.EnvironmentResolver;
import com.flamingo.ai.latexexport.service.latex.model.MathNode;
import com.flamingo.ai.latexexport.service.latex.model.ReconstructionRecord;
import com.flamingo.ai.latexexport.service.latex.model.WrappedLatex;
import com.flamingo.ai.latexexport.service.latex.scan.ExportWorkspace;
import com.flamingo.ai.latexexport.service.latex.semantic.SemanticMathConverter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Replaces rendered math containers with their reconstructed LaTeX in two phases.
 *
 * <p>Replacing a container while walking the containers would shift the tree under the elements
 * still to be visited. Instead:
 *
 * <ol>
 *   <li><b>Mark</b> stores the wrapped, HTML-escaped LaTeX on each container as {@value
 *       #REPLACEMENT_TEXT_ATTR}, gives it a run-scoped {@value #REPLACEMENT_ID_ATTR}, and tags the
 *       container's parent with {@value #PARENT_ID_ATTR}. No structure changes.
 *   <li><b>Commit</b> re-queries the marked containers and replaces them last-to-first, so every
 *       replacement happens downstream of the containers not yet replaced.
 * </ol>
 *
 * <p>Marking N nodes commits exactly N replacements or the commit fails as a whole.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarkAndReplaceEngine {

  public static final String REPLACEMENT_ID_ATTR = "data-replacement-id";
  public static final String REPLACEMENT_TEXT_ATTR = "data-replacement-text";
  public static final String PARENT_ID_ATTR = "data-math-parent-id";

  private static final String CORRUPT_ANNOTATION_MARKER = "undefined";

  private final EnvironmentResolver environmentResolver;
  private final SemanticMathConverter semanticMathConverter;
  private final LatexExportConfig config;

  /**
   * Computes and attaches the replacement payload of every node.
   *
   * @param nodes scanned nodes in document order
   * @param runId id of the current export run
   * @return the records created, in scan order
   */
  public MarkResult mark(List<MathNode> nodes, String runId) {
    String markerId = config.getReplace().getMarkerPrefix() + "-" + runId;
    List<ReconstructionRecord> records = new ArrayList<>(nodes.size());
    Set<Integer> seenNodes = new HashSet<>();
    int semanticFallbacks = 0;
    int unconvertible = 0;

    for (int index = 0; index < nodes.size(); index++) {
      MathNode node = nodes.get(index);
      if (!seenNodes.add(node.id())) {
        throw new MathReconstructionException(
            ReconstructionPhase.MARK, "Node " + node.id() + " scanned twice");
      }

      String latex;
      if (node.hasAnnotation()) {
        latex = node.annotation();
        if (latex.contains(CORRUPT_ANNOTATION_MARKER)) {
          log.warn("Empty or invalid LaTeX annotation on node {}, leaving as-is", node.id());
          unconvertible++;
          continue;
        }
      } else if (node.hasSemanticTree()) {
        log.debug("No LaTeX annotation on node {}, using semantic extraction", node.id());
        latex = semanticMathConverter.convert(node.semanticTree());
        if (latex.isBlank()) {
          log.warn("Could not extract LaTeX from node {}, leaving as-is", node.id());
          unconvertible++;
          continue;
        }
        semanticFallbacks++;
      } else {
        log.debug("No MathML found in node {}, skipping", node.id());
        unconvertible++;
        continue;
      }

      WrappedLatex wrapped =
          environmentResolver.resolve(latex, node.display(), node.environmentHint());
      String payload = escapeHtml(wrapped.text());
      String replacementId = markerId + "-" + records.size();

      Element element = node.element();
      element.attr(REPLACEMENT_ID_ATTR, replacementId);
      element.attr(REPLACEMENT_TEXT_ATTR, payload);
      tagParent(element, markerId, records.size());

      records.add(new ReconstructionRecord(node.id(), replacementId, payload, index));
      log.debug("Marked node {} as {} ({})", node.id(), replacementId, wrapped.source());
    }

    log.debug("Marked {} of {} math nodes", records.size(), nodes.size());
    return new MarkResult(markerId, records, semanticFallbacks, unconvertible);
  }

  /**
   * Replaces every container marked in {@code markResult}, last-to-first.
   *
   * @return number of replacements committed, always {@code markResult.records().size()}
   * @throws MathReconstructionException if the marked containers found differ from the records
   */
  public int commit(ExportWorkspace workspace, MarkResult markResult) {
    List<Element> marked =
        new ArrayList<>(
            workspace
                .root()
                .select("[" + REPLACEMENT_ID_ATTR + "^=\"" + markResult.markerId() + "-\"]"));
    int expected = markResult.records().size();
    if (marked.size() != expected) {
      throw new MathReconstructionException(
          ReconstructionPhase.COMMIT,
          "Expected " + expected + " marked containers but found " + marked.size());
    }

    Collections.reverse(marked);
    int committed = 0;
    for (Element element : marked) {
      String payload = element.attr(REPLACEMENT_TEXT_ATTR);
      if (element.parent() == null) {
        throw new MathReconstructionException(
            ReconstructionPhase.COMMIT,
            "Marked container " + element.attr(REPLACEMENT_ID_ATTR) + " has no parent");
      }
      element.before(payload);
      element.remove();
      committed++;
    }

    log.debug("Committed {} replacements (reverse order)", committed);
    return committed;
  }

  private void tagParent(Element element, String markerId, int markerCount) {
    Element parent = element.parent();
    if (parent != null && !parent.hasAttr(PARENT_ID_ATTR)) {
      parent.attr(PARENT_ID_ATTR, "parent-" + markerId + "-" + markerCount);
    }
  }

  /** Escapes {@code &}, {@code <} and {@code >} so the payload parses back as plain text. */
  static String escapeHtml(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
