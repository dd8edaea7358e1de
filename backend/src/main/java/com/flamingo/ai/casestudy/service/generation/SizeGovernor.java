package com.flamingo.ai.casestudy.service.generation;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.exception.ResourceExhaustedException;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.time.Duration;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Byte and character budgets for every pipeline stage: per-file and aggregate upload limits, the
 * reading policy for large files, and admission of a document to the generative backend.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SizeGovernor {

  private final CaseStudyProperties properties;

  /**
   * How a file of a given size is read.
   *
   * @param options reader switches
   * @param skipGenerativeProcessing mark the document for heuristic-only generation
   */
  public record ReadPolicy(ReadOptions options, boolean skipGenerativeProcessing) {}

  /**
   * Rejects a single file above the per-file limit.
   *
   * @param fileName file name for the error message
   * @param sizeBytes file size
   * @throws ResourceExhaustedException if the file is too large
   */
  public void checkFileSize(String fileName, long sizeBytes) {
    long max = properties.getLimits().getMaxFileBytes();
    if (sizeBytes > max) {
      log.warn("Rejecting {}: {} bytes exceeds {} bytes", fileName, sizeBytes, max);
      throw new ResourceExhaustedException("File " + fileName, sizeBytes, max);
    }
  }

  /**
   * Rejects a multi-document upload whose combined size is above the aggregate limit.
   *
   * @param totalBytes sum of all file sizes
   * @throws ResourceExhaustedException if the upload is too large
   */
  public void checkAggregateSize(long totalBytes) {
    long max = properties.getLimits().getMaxTotalBytes();
    if (totalBytes > max) {
      log.warn("Rejecting upload: combined size {} bytes exceeds {} bytes", totalBytes, max);
      throw new ResourceExhaustedException("Combined upload", totalBytes, max);
    }
  }

  /**
   * Decides how to read a file. Large files skip generative processing; PDFs above the large
   * threshold and any file above the very-large threshold are read without images.
   *
   * @param type file format
   * @param sizeBytes file size
   * @return the reading policy
   */
  public ReadPolicy readPolicy(SourceType type, long sizeBytes) {
    CaseStudyProperties.Limits limits = properties.getLimits();
    boolean large = sizeBytes > limits.getLargeFileBytes();
    boolean veryLarge = sizeBytes > limits.getVeryLargeFileBytes();
    if (large) {
      log.info("Large file detected ({} MB). Optimizing processing", sizeBytes / 1024 / 1024);
    }
    boolean skipImages = veryLarge || (large && type == SourceType.PDF);
    return new ReadPolicy(skipImages ? ReadOptions.TEXT_ONLY : ReadOptions.FULL, large);
  }

  /**
   * Whether extracted text is long enough to be capped at ingest.
   *
   * @param sizeBytes source file size
   * @param textLength extracted text length
   * @return {@code true} if the ingest cap applies
   */
  public boolean exceedsIngestCap(long sizeBytes, int textLength) {
    CaseStudyProperties.Limits limits = properties.getLimits();
    return sizeBytes > limits.getIngestTextCapFileBytes()
        && textLength > limits.getIngestTextCapChars();
  }

  /**
   * Checks whether a document may be sent to the generative backend at all.
   *
   * @param document extracted document
   * @return the reason to go straight to the heuristic generator, or empty if admitted
   */
  public Optional<String> generationRejection(ExtractedDocument document) {
    CaseStudyProperties.Generation generation = properties.getGeneration();
    if (document.skipGenerativeProcessing()) {
      return Optional.of("skip_flag");
    }
    if (document.sizeBytes() > generation.getAbsoluteFileCapBytes()) {
      return Optional.of("file_size_cap");
    }
    if (document.text().isBlank()) {
      return Optional.of("empty_text");
    }
    if (document.text().length() > generation.getHardCapChars()) {
      return Optional.of("text_hard_cap");
    }
    return Optional.empty();
  }

  public boolean isLargeInput(String text) {
    return text.length() > properties.getGeneration().getLargeInputChars();
  }

  /**
   * Time allowed for one generative attempt.
   *
   * @param largeInput whether the original text was large
   * @return attempt timeout
   */
  public Duration attemptTimeout(boolean largeInput) {
    CaseStudyProperties.Generation generation = properties.getGeneration();
    return Duration.ofSeconds(
        largeInput ? generation.getLargeTimeoutSeconds() : generation.getTimeoutSeconds());
  }
}
