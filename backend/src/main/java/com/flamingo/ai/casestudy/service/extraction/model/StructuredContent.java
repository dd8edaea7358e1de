package com.flamingo.ai.casestudy.service.extraction.model;

import java.util.List;
import java.util.Optional;

/**
 * Heuristic outline of a document derived from its raw text.
 *
 * @param title first non-empty line, or {@code null} when the text is too short
 * @param sections heading-delimited partition of the text, in document order
 * @param keyPoints at most seven short statements
 * @param entities regex-extracted entities
 */
public record StructuredContent(
    String title,
    List<DocumentSection> sections,
    List<String> keyPoints,
    DocumentEntities entities) {

  public static final int MAX_KEY_POINTS = 7;

  public StructuredContent {
    sections = sections != null ? List.copyOf(sections) : List.of();
    keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
    entities = entities != null ? entities : DocumentEntities.empty();
  }

  public static StructuredContent empty() {
    return new StructuredContent(null, List.of(), List.of(), DocumentEntities.empty());
  }

  public Optional<String> titleIfPresent() {
    return Optional.ofNullable(title).filter(t -> !t.isBlank());
  }

  public StructuredContent withTitle(String newTitle) {
    return new StructuredContent(newTitle, sections, keyPoints, entities);
  }
}
