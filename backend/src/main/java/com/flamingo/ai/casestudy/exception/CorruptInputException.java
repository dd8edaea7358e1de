package com.flamingo.ai.casestudy.exception;

import com.flamingo.ai.casestudy.service.extraction.model.SourceType;

/** Exception thrown when a container cannot be parsed even after a text-only recovery pass. */
public class CorruptInputException extends DocumentProcessingException {

  private final SourceType sourceType;

  public CorruptInputException(SourceType sourceType, String message, Throwable cause) {
    super(
        ErrorCategory.CORRUPT_INPUT,
        message,
        "Your "
            + sourceType.getDisplayName()
            + " may be corrupted, password-protected, or in an unsupported format.",
        cause);
    this.sourceType = sourceType;
  }

  public SourceType getSourceType() {
    return sourceType;
  }
}
