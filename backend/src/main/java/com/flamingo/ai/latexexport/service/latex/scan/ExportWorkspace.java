package com.flamingo.ai.latexexport.service.latex.scan;

import com.flamingo.ai.latexexport.exception.MathReconstructionException;
import com.flamingo.ai.latexexport.exception.ReconstructionPhase;
import com.flamingo.ai.latexexport.service.latex.model.ScanMode;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * The tree one export run works on, owned exclusively by that run.
 *
 * <p>In {@link ScanMode#STATIC} mode it is a fresh parse of the export content. In {@link
 * ScanMode#LIVE} mode it is a deep clone of the caller's rendered output element, placed in a
 * hidden holder so the caller's tree is never touched. {@link #close()} detaches the clone; callers
 * open the workspace in a try-with-resources block so that happens on every exit path.
 */
@Slf4j
public final class ExportWorkspace implements AutoCloseable {

  private final ScanMode mode;
  private Element root;

  private ExportWorkspace(ScanMode mode, Element root) {
    this.mode = mode;
    this.root = root;
  }

  /** Parses {@code content} into an offline tree rooted at its {@code <body>}. */
  public static ExportWorkspace parse(String content) {
    Document document = Jsoup.parse(content);
    document.outputSettings().prettyPrint(false);
    return new ExportWorkspace(ScanMode.STATIC, document.body());
  }

  /**
   * Clones {@code liveOutput} into a detached holder element.
   *
   * @param liveOutput rendered output element of the caller's tree; not modified
   * @param runId export run id, used to name the holder
   * @throws MathReconstructionException if the clone cannot be created
   */
  public static ExportWorkspace cloneOf(Element liveOutput, String runId) {
    try {
      Document shell = Document.createShell(liveOutput.baseUri());
      shell.outputSettings().prettyPrint(false);
      Element holder =
          shell
              .body()
              .appendElement("div")
              .id("temp-export-processing-" + runId)
              .attr("hidden", true);
      holder.appendChild(liveOutput.clone());
      return new ExportWorkspace(ScanMode.LIVE, holder);
    } catch (RuntimeException e) {
      throw new MathReconstructionException(
          ReconstructionPhase.CLONE, "Failed to clone live output tree: " + e.getMessage(), e);
    }
  }

  public ScanMode mode() {
    return mode;
  }

  /** Element whose descendants are scanned and whose inner HTML is the export result. */
  public Element root() {
    if (root == null) {
      throw new IllegalStateException("Export workspace already closed");
    }
    return root;
  }

  /** Inner HTML of the root; in live mode that is the processed clone of the output element. */
  public String serialize() {
    return root().html();
  }

  @Override
  public void close() {
    if (root == null) {
      return;
    }
    if (mode == ScanMode.LIVE) {
      root.remove();
      log.debug("Temporary live-tree clone released");
    }
    root = null;
  }
}
