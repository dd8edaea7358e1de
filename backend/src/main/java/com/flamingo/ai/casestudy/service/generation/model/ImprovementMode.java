package com.flamingo.ai.casestudy.service.generation.model;

import java.util.Locale;

/** Editing styles offered by the text improvement operation. */
public enum ImprovementMode {
  IMPROVE,
  SIMPLIFY,
  EXTEND;

  /**
   * Parses a mode name case-insensitively. Unknown or blank names map to {@link #IMPROVE}.
   *
   * @param name mode name such as {@code "simplify"}
   * @return the mode
   */
  public static ImprovementMode fromName(String name) {
    if (name == null || name.isBlank()) {
      return IMPROVE;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return IMPROVE;
    }
  }
}
