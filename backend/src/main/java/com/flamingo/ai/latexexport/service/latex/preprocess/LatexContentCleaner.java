package com.flamingo.ai.latexexport.service.latex.preprocess;

import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Normalises export content before scanning: comments, blank lines, line endings. */
@Component
@Slf4j
public class LatexContentCleaner {

  private static final Pattern HTML_COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
  private static final Pattern BLANK_LINE =
      Pattern.compile("^[ \\t\\x0B\\f]*\\n", Pattern.MULTILINE);

  private static final Pattern MATHJAX_SCRIPT =
      Pattern.compile(
          "<script[^>]*mathjax[^>]*>.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern MATHJAX_STYLE =
      Pattern.compile(
          "<style[^>]*mathjax[^>]*>.*?</style>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  /**
   * Strips HTML comments, normalises {@code \r\n} and lone {@code \r} to {@code \n}, drops blank
   * lines and trims the result.
   */
  public String clean(String content) {
    if (content == null) {
      return "";
    }
    String cleaned = HTML_COMMENT.matcher(content).replaceAll("");
    cleaned = cleaned.replace("\r\n", "\n").replace('\r', '\n');
    cleaned = BLANK_LINE.matcher(cleaned).replaceAll("");
    cleaned = cleaned.trim();
    log.debug("Content cleaned, length: {}", cleaned.length());
    return cleaned;
  }

  /** Removes {@code <script>} and {@code <style>} blocks whose opening tag mentions MathJax. */
  public String stripTypesetterArtifacts(String html) {
    String stripped = MATHJAX_SCRIPT.matcher(html).replaceAll("");
    return MATHJAX_STYLE.matcher(stripped).replaceAll("");
  }
}
