package com.flamingo.ai.latexexport.api.rest;

import com.flamingo.ai.latexexport.api.dto.request.LatexExportRequest;
import com.flamingo.ai.latexexport.api.dto.response.LatexExportResponse;
import com.flamingo.ai.latexexport.service.latex.ExportResult;
import com.flamingo.ai.latexexport.service.latex.LatexExportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for LaTeX export. */
@RestController
@RequestMapping("/api/export")
@RequiredArgsConstructor
public class LatexExportController {

  private final LatexExportService latexExportService;

  /** Replaces rendered math in the submitted HTML with reconstructed LaTeX. */
  @PostMapping("/latex")
  public ResponseEntity<LatexExportResponse> exportLatex(
      @Valid @RequestBody LatexExportRequest request) {
    ExportResult result = latexExportService.processWithReport(request.getContent(), null);
    return ResponseEntity.ok(LatexExportResponse.fromResult(request.getContent(), result));
  }
}
