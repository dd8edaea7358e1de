package com.flamingo.ai.casestudy.exception;

/** The backend rejected the request because of rate limiting. Never retried. */
public class BackendRateLimitedException extends LlmServiceException {

  public BackendRateLimitedException(String message, Throwable cause) {
    super(ErrorCategory.LLM_RATE_LIMITED, message, cause);
  }
}
