package com.flamingo.ai.casestudy;

import com.flamingo.ai.casestudy.service.extraction.StructureExtractor;
import com.flamingo.ai.casestudy.service.extraction.model.DocumentMetadata;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.extraction.model.ProcessingStatus;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.time.Instant;
import java.util.List;

/** Builders for extracted documents used across tests. */
public final class TestDocuments {

  private static final StructureExtractor STRUCTURE_EXTRACTOR = new StructureExtractor();

  private TestDocuments() {}

  public static ExtractedDocument document(String text, SourceType type) {
    return document(text, type, List.of());
  }

  public static ExtractedDocument document(
      String text, SourceType type, List<ExtractedImage> images) {
    return new ExtractedDocument(
        text,
        images,
        STRUCTURE_EXTRACTOR.extract(text, type),
        metadata(type, text.length()).build());
  }

  public static DocumentMetadata.DocumentMetadataBuilder metadata(SourceType type, long size) {
    return DocumentMetadata.builder()
        .sourceType(type)
        .sourceName("sample." + type.name().toLowerCase())
        .sizeBytes(size)
        .status(ProcessingStatus.SUCCESS)
        .processedAt(Instant.parse("2024-01-01T00:00:00Z"));
  }

  public static ExtractedImage image(String id, String caption) {
    return ExtractedImage.of(id, caption, "png", new byte[] {1, 2, 3}, -1);
  }
}
