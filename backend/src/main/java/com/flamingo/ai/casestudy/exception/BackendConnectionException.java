package com.flamingo.ai.casestudy.exception;

/** The backend could not be reached. */
public class BackendConnectionException extends LlmServiceException {

  public BackendConnectionException(String message, Throwable cause) {
    super(ErrorCategory.LLM_UNAVAILABLE, message, cause);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}
