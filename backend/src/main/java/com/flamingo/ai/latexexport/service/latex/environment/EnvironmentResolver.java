package com.flamingo.ai.latexexport.service.latex.environment;

import com.flamingo.ai.latexexport.service.latex.model.EnvironmentSource;
import com.flamingo.ai.latexexport.service.latex.model.WrappedLatex;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses the delimiters or environment that reconstructed LaTeX is wrapped in.
 *
 * <p>The typesetting pass keeps only the body of an environment in its annotation, so the wrapper
 * has to be recovered. Resolution order, first match wins:
 *
 * <ol>
 *   <li>an environment name stored on the node by an upstream stage
 *   <li>LaTeX that already opens with {@code \begin{...}} is returned unchanged
 *   <li>heuristics: {@code &} plus a line break gives {@code align*}, a line break alone gives
 *       {@code gather*}, anything else gives {@code \[...\]} or {@code \(...\)}
 * </ol>
 *
 * <p>The heuristics cannot tell numbered from unnumbered environments, nor {@code align} from
 * {@code alignat} or {@code multline}; they always pick the unnumbered form.
 */
@Component
@Slf4j
public class EnvironmentResolver {

  private static final Pattern ALREADY_WRAPPED = Pattern.compile("^\\s*\\\\begin\\{[^}]+}");

  /**
   * Wraps {@code latex} in the environment it most likely came from. Never throws.
   *
   * @param latex unwrapped LaTeX body
   * @param display whether the node is display math
   * @param environmentHint stored environment name, may be {@code null}
   * @return the wrapped LaTeX and the rule that produced it
   */
  public WrappedLatex resolve(String latex, boolean display, String environmentHint) {
    String body = latex == null ? "" : latex;

    if (environmentHint != null && !environmentHint.isBlank()) {
      if (isUsableHint(environmentHint)) {
        String env = environmentHint.trim();
        log.debug("Using stored environment: {}", env);
        return new WrappedLatex(
            "\\begin{" + env + "}\n" + body + "\n\\end{" + env + "}",
            EnvironmentSource.STORED_HINT);
      }
      log.warn("Ignoring malformed environment hint: \"{}\"", environmentHint);
    }

    if (ALREADY_WRAPPED.matcher(body).find()) {
      log.debug("LaTeX already has an environment wrapper, returning as-is");
      return new WrappedLatex(body, EnvironmentSource.ALREADY_WRAPPED);
    }

    boolean hasAlignment = body.contains("&");
    boolean hasLineBreaks = body.contains("\\\\") || body.contains("\\\n");

    if (hasAlignment && hasLineBreaks) {
      log.debug("No stored environment, defaulting to align* (heuristic)");
      return new WrappedLatex(
          "\\begin{align*}\n" + body + "\n\\end{align*}", EnvironmentSource.ALIGN_HEURISTIC);
    }
    if (hasLineBreaks) {
      log.debug("No stored environment, defaulting to gather* (heuristic)");
      return new WrappedLatex(
          "\\begin{gather*}\n" + body + "\n\\end{gather*}", EnvironmentSource.GATHER_HEURISTIC);
    }
    if (display) {
      return new WrappedLatex("\\[" + body + "\\]", EnvironmentSource.DISPLAY);
    }
    return new WrappedLatex("\\(" + body + "\\)", EnvironmentSource.INLINE);
  }

  /**
   * Whether a stored hint can be used as an environment name. Rejects blank values and values
   * that look like a serialized object or array.
   */
  public boolean isUsableHint(String environmentHint) {
    if (environmentHint == null) {
      return false;
    }
    String trimmed = environmentHint.trim();
    return !trimmed.isEmpty() && !trimmed.startsWith("{") && !trimmed.startsWith("[");
  }
}
