package com.flamingo.ai.latexexport.service.latex.scan;

import static com.flamingo.ai.latexexport.service.latex.MathJaxFixtures.annotated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.latexexport.config.LatexExportConfig;
import com.flamingo.ai.latexexport.exception.MathReconstructionException;
import com.flamingo.ai.latexexport.exception.ReconstructionPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProtectedRegionMasker Tests")
class ProtectedRegionMaskerTest {

  private static final String SKIPPED =
      "<div data-skip-latex-export=\"true\"><p>\\begin{equation}x\\end{equation}</p>"
          + "<script src=\"mathjax.js\"></script></div>";

  private ProtectedRegionMasker masker;

  @BeforeEach
  void setUp() {
    masker = new ProtectedRegionMasker(new LatexExportConfig());
  }

  @Test
  @DisplayName("should hide protected markup from the serialized text and restore it verbatim")
  void shouldMaskAndRestore() {
    String tikz = annotated("t", false, "application/x-tex", " data-tikz-math=\"true\"");
    String html = "<p>before</p>" + SKIPPED + tikz + "<p>after</p>";

    try (ExportWorkspace workspace = ExportWorkspace.parse(html)) {
      MaskedRegions masked = masker.mask(workspace, "run1");
      String serialized = workspace.serialize();

      assertThat(masked.count()).isEqualTo(2);
      assertThat(serialized)
          .isEqualTo(
              "<p>before</p><!--latex-export-protected-run1-0-->"
                  + "<!--latex-export-protected-run1-1--><p>after</p>");
      assertThat(masked.restore(serialized)).isEqualTo(html);
    }
  }

  @Test
  @DisplayName("should mask only the outermost protected element")
  void shouldMaskOutermostOnly() {
    String tikz = annotated("t", false, "application/x-tex", " data-tikz-math=\"true\"");
    String html = "<section data-skip-latex-export=\"true\">" + tikz + "</section>";

    try (ExportWorkspace workspace = ExportWorkspace.parse(html)) {
      MaskedRegions masked = masker.mask(workspace, "run2");

      assertThat(masked.count()).isEqualTo(1);
      assertThat(masked.restore(workspace.serialize())).isEqualTo(html);
    }
  }

  @Test
  @DisplayName("should leave unprotected content alone")
  void shouldReturnNothing_whenNoProtectedRegions() {
    try (ExportWorkspace workspace = ExportWorkspace.parse("<p>plain</p>")) {
      MaskedRegions masked = masker.mask(workspace, "run3");

      assertThat(masked.count()).isZero();
      assertThat(masked.restore(workspace.serialize())).isEqualTo("<p>plain</p>");
    }
  }

  @Test
  @DisplayName("should fail when a placeholder was lost during post-processing")
  void shouldFail_whenPlaceholderLost() {
    try (ExportWorkspace workspace = ExportWorkspace.parse(SKIPPED)) {
      MaskedRegions masked = masker.mask(workspace, "run4");

      assertThatThrownBy(() -> masked.restore("<p>rewritten</p>"))
          .isInstanceOfSatisfying(
              MathReconstructionException.class,
              e -> assertThat(e.getPhase()).isEqualTo(ReconstructionPhase.POST_PROCESS));
    }
  }
}
