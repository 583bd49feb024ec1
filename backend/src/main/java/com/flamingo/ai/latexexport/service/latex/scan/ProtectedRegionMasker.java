package com.flamingo.ai.latexexport.service.latex.scan;

import com.flamingo.ai.latexexport.config.LatexExportConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Takes protected regions out of a workspace before its text is post-processed.
 *
 * <p>Each outermost protected element is replaced by a placeholder comment and its serialized HTML
 * is kept aside. Text-level passes (artifact stripping, nesting repair) then run over the
 * serialized workspace without seeing protected content, and {@link
 * MaskedRegions#restore(String)} puts the original markup back byte for byte.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProtectedRegionMasker {

  private final LatexExportConfig config;

  public MaskedRegions mask(ExportWorkspace workspace, String runId) {
    LatexExportConfig.Scan scan = config.getScan();
    String query = scan.getProtectedSelector() + ", [" + scan.getProtectedAttribute() + "]";

    Map<String, String> regions = new LinkedHashMap<>();
    for (Element element : workspace.root().select(query)) {
      if (element.parent() == null || !isOutermost(element, query)) {
        continue;
      }
      String token =
          config.getReplace().getMarkerPrefix() + "-protected-" + runId + "-" + regions.size();
      // outerHtml must be taken while the element still uses the workspace output settings
      regions.put("<!--" + token + "-->", element.outerHtml());
      element.replaceWith(new Comment(token));
    }

    if (!regions.isEmpty()) {
      log.debug("Masked {} protected region(s) before post-processing", regions.size());
    }
    return new MaskedRegions(regions);
  }

  private boolean isOutermost(Element element, String query) {
    Element parent = element.parent();
    return parent == null || parent.closest(query) == null;
  }
}
