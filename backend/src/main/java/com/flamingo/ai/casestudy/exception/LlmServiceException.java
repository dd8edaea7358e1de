package com.flamingo.ai.casestudy.exception;

/** Exception thrown when the generative backend fails. */
public class LlmServiceException extends RuntimeException {

  private final ErrorCategory category;

  public LlmServiceException(String message) {
    this(ErrorCategory.LLM_UNAVAILABLE, message, null);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(ErrorCategory.LLM_UNAVAILABLE, message, cause);
  }

  protected LlmServiceException(ErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
  }

  public ErrorCategory getCategory() {
    return category;
  }

  public boolean isRateLimited() {
    return category == ErrorCategory.LLM_RATE_LIMITED;
  }

  /** Whether the failure is network-class and worth retrying with a smaller prompt. */
  public boolean isTransient() {
    return false;
  }
}
