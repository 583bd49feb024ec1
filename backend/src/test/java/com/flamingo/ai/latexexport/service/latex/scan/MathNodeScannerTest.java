package com.flamingo.ai.latexexport.service.latex.scan;

import static com.flamingo.ai.latexexport.service.latex.MathJaxFixtures.annotated;
import static com.flamingo.ai.latexexport.service.latex.MathJaxFixtures.bare;
import static com.flamingo.ai.latexexport.service.latex.MathJaxFixtures.display;
import static com.flamingo.ai.latexexport.service.latex.MathJaxFixtures.inline;
import static com.flamingo.ai.latexexport.service.latex.MathJaxFixtures.semantic;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.latexexport.config.LatexExportConfig;
import com.flamingo.ai.latexexport.exception.MathReconstructionException;
import com.flamingo.ai.latexexport.exception.ReconstructionPhase;
import com.flamingo.ai.latexexport.service.latex.environment.EnvironmentResolver;
import com.flamingo.ai.latexexport.service.latex.model.MathNode;
import com.flamingo.ai.latexexport.service.latex.model.SemanticNodeKind;
import com.flamingo.ai.latexexport.service.latex.semantic.SemanticTreeReader;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MathNodeScanner Tests")
class MathNodeScannerTest {

  private MathNodeScanner scanner;

  @BeforeEach
  void setUp() {
    scanner =
        new MathNodeScanner(
            new LatexExportConfig(), new EnvironmentResolver(), new SemanticTreeReader());
  }

  private List<MathNode> scan(String html) {
    try (ExportWorkspace workspace = ExportWorkspace.parse(html)) {
      return scanner.scan(workspace);
    }
  }

  @Test
  @DisplayName("should return nodes in document order with sequential ids")
  void shouldReturnNodesInDocumentOrder() {
    String html =
        "<h1>T</h1><p>"
            + inline("a")
            + "</p><div><ul><li>"
            + inline("b")
            + "</li></ul>"
            + display("c")
            + "</div><p>"
            + inline("d")
            + "</p>";

    List<MathNode> nodes = scan(html);

    assertThat(nodes).extracting(MathNode::annotation).containsExactly("a", "b", "c", "d");
    assertThat(nodes).extracting(MathNode::id).containsExactly(0, 1, 2, 3);
    assertThat(nodes).extracting(MathNode::display).containsExactly(false, false, true, false);
  }

  @Test
  @DisplayName("should decode annotation entities and keep line breaks")
  void shouldReadAnnotationText() {
    List<MathNode> nodes = scan(display("a&=b\\\\\nc<d"));

    assertThat(nodes.get(0).annotation()).isEqualTo("a&=b\\\\\nc<d");
  }

  @Test
  @DisplayName("should fall back through alternative annotation encodings")
  void shouldUseAlternativeEncodings() {
    List<MathNode> nodes =
        scan(annotated("y", false, "TeX", "") + annotated("z", false, "LaTeX", ""));

    assertThat(nodes).extracting(MathNode::annotation).containsExactly("y", "z");
  }

  @Test
  @DisplayName("should snapshot the semantic tree when no annotation exists")
  void shouldReadSemanticTree_whenNoAnnotation() {
    MathNode node = scan(semantic("<mfrac><mi>a</mi><mi>b</mi></mfrac>", false)).get(0);

    assertThat(node.hasAnnotation()).isFalse();
    assertThat(node.semanticTree().kind()).isEqualTo(SemanticNodeKind.MATH);
    assertThat(node.semanticTree().child(0).kind()).isEqualTo(SemanticNodeKind.FRACTION);
  }

  @Test
  @DisplayName("should treat a blank annotation as absent")
  void shouldTreatBlankAnnotationAsAbsent() {
    MathNode node = scan(inline("   ")).get(0);

    assertThat(node.annotation()).isNull();
    assertThat(node.hasSemanticTree()).isTrue();
  }

  @Test
  @DisplayName("should report neither annotation nor tree for containers without MathML")
  void shouldHandleContainerWithoutMathMl() {
    MathNode node = scan(bare()).get(0);

    assertThat(node.hasAnnotation()).isFalse();
    assertThat(node.hasSemanticTree()).isFalse();
  }

  @Test
  @DisplayName("should detect display math from an enclosing legacy span")
  void shouldDetectDisplayFromLegacySpan() {
    MathNode node = scan("<span class=\"math display\">" + inline("x") + "</span>").get(0);

    assertThat(node.display()).isTrue();
  }

  @Test
  @DisplayName("should read the environment hint from the container or its parent")
  void shouldReadEnvironmentHint() {
    String html =
        "<p>"
            + annotated("a", true, "application/x-tex", " data-math-env=\"equation\"")
            + "</p><span data-latex-env=\"multline\">"
            + display("b")
            + "</span>";

    List<MathNode> nodes = scan(html);

    assertThat(nodes).extracting(MathNode::environmentHint).containsExactly("equation", "multline");
  }

  @Test
  @DisplayName("should prefer a usable parent hint over a malformed container hint")
  void shouldSkipMalformedHint_whenParentHintUsable() {
    String html =
        "<span data-math-env=\"align\">"
            + annotated("a", true, "application/x-tex", " data-math-env='{\"env\":1}'")
            + "</span>";

    assertThat(scan(html).get(0).environmentHint()).isEqualTo("align");
  }

  @Test
  @DisplayName("should pass a malformed hint through when it is the only one")
  void shouldPassMalformedHint_whenOnlyOne() {
    String html = annotated("a", true, "application/x-tex", " data-math-env=\"[1]\"");

    assertThat(scan(html).get(0).environmentHint()).isEqualTo("[1]");
  }

  @Test
  @DisplayName("should exclude nodes in protected regions")
  void shouldExcludeProtectedNodes() {
    String html =
        "<p>"
            + inline("keep1")
            + "</p><div data-skip-latex-export=\"true\"><p>"
            + inline("tikz1")
            + "</p></div>"
            + annotated("tikz2", false, "application/x-tex", " data-tikz-math=\"true\"")
            + "<p>"
            + inline("keep2")
            + "</p>";

    List<MathNode> nodes = scan(html);

    assertThat(nodes).extracting(MathNode::annotation).containsExactly("keep1", "keep2");
    assertThat(nodes).extracting(MathNode::id).containsExactly(0, 1);
    assertThat(nodes).noneMatch(MathNode::protectedRegion);
  }

  @Test
  @DisplayName("should skip containers nested inside another container")
  void shouldSkipNestedContainers() {
    String html =
        "<mjx-container display=\"true\">"
            + inline("inner")
            + "<mjx-assistive-mml><math><annotation encoding=\"application/x-tex\">outer"
            + "</annotation></math></mjx-assistive-mml></mjx-container>";

    List<MathNode> nodes = scan(html);

    assertThat(nodes).hasSize(1);
    assertThat(nodes.get(0).display()).isTrue();
  }

  @Test
  @DisplayName("should report an invalid container selector as a scan failure")
  void shouldFailScan_whenSelectorInvalid() {
    LatexExportConfig config = new LatexExportConfig();
    config.getScan().setContainerTag("mjx-container:no-such-pseudo");
    MathNodeScanner misconfigured =
        new MathNodeScanner(config, new EnvironmentResolver(), new SemanticTreeReader());

    try (ExportWorkspace workspace = ExportWorkspace.parse(inline("x"))) {
      assertThatThrownBy(() -> misconfigured.scan(workspace))
          .isInstanceOfSatisfying(
              MathReconstructionException.class,
              e -> assertThat(e.getPhase()).isEqualTo(ReconstructionPhase.SCAN));
    }
  }
}
