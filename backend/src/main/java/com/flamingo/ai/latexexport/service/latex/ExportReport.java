package com.flamingo.ai.latexexport.service.latex;

import com.flamingo.ai.latexexport.service.latex.model.ScanMode;
import java.util.List;

/**
 * Statistics of one export run.
 *
 * @param mode scan mode used
 * @param scanned unprotected math nodes found
 * @param committed replacements committed
 * @param semanticFallbacks nodes reconstructed from their semantic tree
 * @param unconvertible nodes left as rendered because no LaTeX could be recovered
 * @param syntaxIssues advisory delimiter-balance issues found in the input
 * @param nestingRepaired whether invalid environment nesting was repaired
 * @param rolledBack whether the run failed and the original content was returned
 */
public record ExportReport(
    ScanMode mode,
    int scanned,
    int committed,
    int semanticFallbacks,
    int unconvertible,
    List<String> syntaxIssues,
    boolean nestingRepaired,
    boolean rolledBack) {

  public ExportReport {
    syntaxIssues = List.copyOf(syntaxIssues);
  }

  static ExportReport rolledBack(ScanMode mode, List<String> syntaxIssues) {
    return new ExportReport(mode, 0, 0, 0, 0, syntaxIssues, false, true);
  }
}
