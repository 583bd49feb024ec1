package com.flamingo.ai.latexexport.api.dto.response;

import com.flamingo.ai.latexexport.service.latex.ExportReport;
import com.flamingo.ai.latexexport.service.latex.ExportResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a LaTeX export run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LatexExportResponse {

  private String content;
  private int inputLength;
  private int outputLength;
  private int expressionsFound;
  private int expressionsConverted;
  private int semanticFallbacks;
  private List<String> syntaxIssues;
  private boolean nestingRepaired;

  /** True when reconstruction failed and {@code content} is the unmodified input. */
  private boolean rolledBack;

  /** Creates a response from the pipeline result and the request input. */
  public static LatexExportResponse fromResult(String input, ExportResult result) {
    ExportReport report = result.report();
    return LatexExportResponse.builder()
        .content(result.content())
        .inputLength(input.length())
        .outputLength(result.content().length())
        .expressionsFound(report.scanned())
        .expressionsConverted(report.committed())
        .semanticFallbacks(report.semanticFallbacks())
        .syntaxIssues(report.syntaxIssues())
        .nestingRepaired(report.nestingRepaired())
        .rolledBack(report.rolledBack())
        .build();
  }
}
