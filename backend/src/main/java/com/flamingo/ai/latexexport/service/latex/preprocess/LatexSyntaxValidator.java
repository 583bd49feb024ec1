package com.flamingo.ai.latexexport.service.latex.preprocess;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Counts math delimiters and environment markers in export content.
 *
 * <p>Static counting false-positives easily ({@code $} in prose, delimiters inside code blocks), so
 * the result is advisory: the pipeline logs issues and carries on.
 */
@Component
@Slf4j
public class LatexSyntaxValidator {

  private static final Pattern UNESCAPED_DOLLAR = Pattern.compile("(?<!\\\\)\\$");
  private static final Pattern DISPLAY_OPEN = Pattern.compile("\\\\\\[");
  private static final Pattern DISPLAY_CLOSE = Pattern.compile("\\\\]");
  private static final Pattern BEGIN = Pattern.compile("\\\\begin\\{");
  private static final Pattern END = Pattern.compile("\\\\end\\{");

  public SyntaxValidationResult validate(String content) {
    if (content == null) {
      return SyntaxValidationResult.of(List.of());
    }
    List<String> issues = new ArrayList<>();

    if (count(UNESCAPED_DOLLAR, content) % 2 != 0) {
      issues.add("Unmatched inline math delimiters ($)");
    }
    if (count(DISPLAY_OPEN, content) != count(DISPLAY_CLOSE, content)) {
      issues.add("Unmatched display math delimiters (\\[ \\])");
    }
    if (count(BEGIN, content) != count(END, content)) {
      issues.add("Unmatched LaTeX environments (\\begin/\\end)");
    }

    if (issues.isEmpty()) {
      log.debug("LaTeX syntax validation passed");
    } else {
      log.warn("LaTeX syntax issues found: {}", issues);
    }
    return SyntaxValidationResult.of(issues);
  }

  private static int count(Pattern pattern, String content) {
    Matcher matcher = pattern.matcher(content);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
