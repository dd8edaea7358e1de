package com.flamingo.ai.casestudy.service.extraction.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Source formats understood by the extraction pipeline. */
public enum SourceType {
  PDF("PDF document", Set.of("pdf")),
  DOCX("Word document", Set.of("doc", "docx")),
  PPTX("PowerPoint presentation", Set.of("pptx")),
  TXT("text file", Set.of("txt")),
  WEB("web page", Set.of());

  private final String displayName;
  private final Set<String> extensions;

  SourceType(String displayName, Set<String> extensions) {
    this.displayName = displayName;
    this.extensions = extensions;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * Resolves a file extension (without the dot, any case) to its source type.
   *
   * @param extension file extension, e.g. {@code "pptx"}
   * @return the matching type, or empty for unsupported extensions
   */
  public static Optional<SourceType> fromExtension(String extension) {
    if (extension == null || extension.isBlank()) {
      return Optional.empty();
    }
    String normalized = extension.toLowerCase(Locale.ROOT);
    for (SourceType type : values()) {
      if (type.extensions.contains(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  public boolean isPresentation() {
    return this == PPTX;
  }
}
