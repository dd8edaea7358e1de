package com.flamingo.ai.casestudy.service.extraction.model;

import java.time.Instant;
import lombok.Builder;

/**
 * Descriptive and status information attached to an {@link ExtractedDocument}.
 *
 * @param sourceType format the document was read as
 * @param sourceName file name or URL
 * @param sizeBytes size of the source file in bytes (0 for web pages)
 * @param status whether reading succeeded
 * @param errorDetail failure or recovery note, {@code null} when none
 * @param skipGenerativeProcessing route generation straight to the heuristic generator
 * @param recoveredTextOnly images were dropped by a text-only recovery pass
 * @param wordCount number of word tokens in the text
 * @param pageCount pages or slides for paged formats, {@code null} otherwise
 * @param processedAt when extraction finished
 * @param domain host name for web pages
 * @param pageTitle page title for web pages
 * @param publishedDate publication date for web pages, as found in the page
 */
@Builder(toBuilder = true)
public record DocumentMetadata(
    SourceType sourceType,
    String sourceName,
    long sizeBytes,
    ProcessingStatus status,
    String errorDetail,
    boolean skipGenerativeProcessing,
    boolean recoveredTextOnly,
    int wordCount,
    Integer pageCount,
    Instant processedAt,
    String domain,
    String pageTitle,
    String publishedDate) {

  public boolean isSuccess() {
    return status == ProcessingStatus.SUCCESS;
  }
}
