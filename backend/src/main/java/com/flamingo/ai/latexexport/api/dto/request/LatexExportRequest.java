package com.flamingo.ai.latexexport.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for reconstructing LaTeX in rendered export content. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LatexExportRequest {

  /** HTML containing MathJax-rendered math. */
  @NotNull(message = "Content is required")
  private String content;
}
