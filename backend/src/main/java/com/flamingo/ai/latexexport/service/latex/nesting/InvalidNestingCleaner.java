package com.flamingo.ai.latexexport.service.latex.nesting;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Detects and removes {@code equation} wrappers around multi-line environments.
 *
 * <p>{@code \begin{equation}\begin{align}...\end{align}\end{equation}} does not compile: {@code
 * equation} holds a single line and cannot contain the line breaks of {@code align} or {@code
 * gather}. The inner environment already carries the right semantics, so the outer wrapper is
 * dropped. Only {@code equation} around {@code align}, {@code align*}, {@code gather} and {@code
 * gather*} is recognised, and the inner block may not cross another {@code equation} boundary.
 *
 * <p>This is a textual rewrite over the final export text. Run it once, after every replacement has
 * been committed.
 */
@Component
@Slf4j
public class InvalidNestingCleaner {

  private static final Pattern EQUATION_AROUND_MULTILINE =
      Pattern.compile(
          "\\\\begin\\{equation\\}\\s*"
              + "(\\\\begin\\{(align\\*?|gather\\*?)\\}"
              + "(?:(?!\\\\(?:begin|end)\\{equation\\}).)*?"
              + "\\\\end\\{\\2\\})"
              + "\\s*\\\\end\\{equation\\}",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  /** Returns {@code true} if {@code text} contains an {@code equation}-wrapped multi-line block. */
  public boolean detectInvalidNesting(String text) {
    return text != null && EQUATION_AROUND_MULTILINE.matcher(text).find();
  }

  /**
   * Strips every {@code equation} wrapper around an {@code align}/{@code gather} block, keeping the
   * inner block. Repeats until nothing matches, so the result is a fixed point and {@code
   * clean(clean(x)).equals(clean(x))}.
   *
   * @param text export text, may be {@code null}
   * @return cleaned text, or {@code text} itself when nothing matched
   */
  public String cleanInvalidNesting(String text) {
    if (text == null) {
      return null;
    }
    String current = text;
    int repairs = 0;
    while (true) {
      Matcher matcher = EQUATION_AROUND_MULTILINE.matcher(current);
      if (!matcher.find()) {
        break;
      }
      matcher.reset();
      StringBuilder sb = new StringBuilder(current.length());
      while (matcher.find()) {
        matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1)));
        repairs++;
      }
      matcher.appendTail(sb);
      current = sb.toString();
    }
    if (repairs > 0) {
      log.warn("Removed {} invalid equation wrapper(s) around multi-line environments", repairs);
    }
    return current;
  }
}
