package com.flamingo.ai.latexexport.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the rendered-math reconstruction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "latex-export")
@Getter
@Setter
public class LatexExportConfig {

  private Nesting nesting = new Nesting();
  private Artifacts artifacts = new Artifacts();
  private Scan scan = new Scan();
  private Replace replace = new Replace();

  @Getter
  @Setter
  public static class Nesting {
    /** Strip {@code equation} wrappers around {@code align}/{@code gather} after replacement. */
    private boolean cleanEnabled = true;
  }

  @Getter
  @Setter
  public static class Artifacts {
    /** Remove leftover MathJax script and style blocks from the exported text. */
    private boolean stripEnabled = true;
  }

  @Getter
  @Setter
  public static class Scan {
    /** Selector of the element that holds the rendered output inside a live tree. */
    private String liveTreeSelector = "#output";

    private String containerTag = "mjx-container";
    private String assistiveSelector = "mjx-assistive-mml math";

    /** Annotation encodings, tried in order. */
    private List<String> annotationEncodings =
        new ArrayList<>(List.of("application/x-tex", "TeX", "LaTeX"));

    /** Attributes carrying a stored environment name, tried in order on container then parent. */
    private List<String> environmentAttributes =
        new ArrayList<>(List.of("data-math-env", "data-latex-env"));

    private String protectedSelector = "[data-skip-latex-export=true]";
    private String protectedAttribute = "data-tikz-math";
  }

  @Getter
  @Setter
  public static class Replace {
    /** Prefix of the {@code data-replacement-id} values written during the mark phase. */
    private String markerPrefix = "latex-export";
  }
}
