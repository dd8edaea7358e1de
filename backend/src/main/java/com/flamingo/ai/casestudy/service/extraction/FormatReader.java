package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.service.extraction.model.RawExtraction;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceFile;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;

/**
 * Reads one local file format into raw text and images.
 *
 * <p>Implementations are stateless. A failure on a single image, page or shape is logged and
 * skipped; only an unreadable container raises, as a {@link
 * com.flamingo.ai.casestudy.exception.DocumentProcessingException}. Every file handle opened
 * during a read is closed before the method returns.
 */
public interface FormatReader {

  /**
   * Reads the given file.
   *
   * @param source file to read
   * @param options size-policy switches
   * @return recovered text and images
   */
  RawExtraction read(SourceFile source, ReadOptions options);

  /**
   * Returns {@code true} if this reader handles the given format.
   *
   * @param type source format
   * @return {@code true} if supported
   */
  boolean supports(SourceType type);

  /**
   * Whether a failed full read should be retried with {@link ReadOptions#TEXT_ONLY}.
   *
   * @return {@code true} if a text-only pass can succeed where a full pass failed
   */
  default boolean supportsTextOnlyRecovery() {
    return false;
  }
}
