package com.flamingo.ai.casestudy.service.extraction.model;

import java.util.List;
import java.util.Objects;

/**
 * Normalised result of reading one source file or URL. It is the sole input to case study
 * generation.
 *
 * @param text extracted plain text (never {@code null}, may be empty)
 * @param images extracted images in document order
 * @param structuredContent heuristic outline of {@code text}
 * @param metadata source description and status
 */
public record ExtractedDocument(
    String text,
    List<ExtractedImage> images,
    StructuredContent structuredContent,
    DocumentMetadata metadata) {

  public ExtractedDocument {
    text = text != null ? text : "";
    images = images != null ? List.copyOf(images) : List.of();
    structuredContent = structuredContent != null ? structuredContent : StructuredContent.empty();
    Objects.requireNonNull(metadata, "metadata");
  }

  public SourceType sourceType() {
    return metadata.sourceType();
  }

  public long sizeBytes() {
    return metadata.sizeBytes();
  }

  public boolean skipGenerativeProcessing() {
    return metadata.skipGenerativeProcessing();
  }
}
