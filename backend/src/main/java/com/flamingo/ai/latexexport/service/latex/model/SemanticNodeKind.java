package com.flamingo.ai.latexexport.service.latex.model;

import java.util.Locale;

/** Closed set of MathML element kinds understood by the semantic converter. */
public enum SemanticNodeKind {
  MATH("math"),
  ROW("mrow"),
  IDENTIFIER("mi"),
  NUMBER("mn"),
  OPERATOR("mo"),
  TEXT("mtext"),
  SUPERSCRIPT("msup"),
  SUBSCRIPT("msub"),
  FRACTION("mfrac"),
  SQUARE_ROOT("msqrt"),
  ROOT("mroot"),
  SPACE("mspace"),
  UNKNOWN(null);

  private final String tagName;

  SemanticNodeKind(String tagName) {
    this.tagName = tagName;
  }

  public String tagName() {
    return tagName;
  }

  /** Maps a MathML tag name (case-insensitive) to its kind, {@link #UNKNOWN} if unsupported. */
  public static SemanticNodeKind fromTag(String tag) {
    if (tag == null) {
      return UNKNOWN;
    }
    String normalized = tag.toLowerCase(Locale.ROOT);
    for (SemanticNodeKind kind : values()) {
      if (normalized.equals(kind.tagName)) {
        return kind;
      }
    }
    return UNKNOWN;
  }
}
