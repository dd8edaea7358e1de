package com.flamingo.ai.casestudy.service.extraction.model;

import java.util.List;

/**
 * What a {@link com.flamingo.ai.casestudy.service.extraction.FormatReader} produces before the
 * document is assembled.
 *
 * @param text extracted text
 * @param images extracted images
 * @param pageCount pages or slides read, {@code null} for unpaged formats
 * @param recoveredTextOnly {@code true} if a text-only recovery pass produced this result
 */
public record RawExtraction(
    String text, List<ExtractedImage> images, Integer pageCount, boolean recoveredTextOnly) {

  public RawExtraction {
    text = text != null ? text : "";
    images = images != null ? List.copyOf(images) : List.of();
  }

  public static RawExtraction textOnly(String text, Integer pageCount) {
    return new RawExtraction(text, List.of(), pageCount, false);
  }

  public RawExtraction asRecovered() {
    return new RawExtraction(text, List.of(), pageCount, true);
  }
}
