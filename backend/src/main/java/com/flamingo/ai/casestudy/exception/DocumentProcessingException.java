package com.flamingo.ai.casestudy.exception;

/** Exception thrown when a source document cannot be read. */
public class DocumentProcessingException extends RuntimeException {

  private final ErrorCategory category;
  private final String userMessage;

  public DocumentProcessingException(ErrorCategory category, String message, String userMessage) {
    super(message);
    this.category = category;
    this.userMessage = userMessage;
  }

  public DocumentProcessingException(
      ErrorCategory category, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.category = category;
    this.userMessage = userMessage;
  }

  public ErrorCategory getCategory() {
    return category;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
