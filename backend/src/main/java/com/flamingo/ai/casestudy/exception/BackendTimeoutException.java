package com.flamingo.ai.casestudy.exception;

/** The backend did not answer within its own request timeout. */
public class BackendTimeoutException extends LlmServiceException {

  public BackendTimeoutException(String message, Throwable cause) {
    super(ErrorCategory.LLM_TIMEOUT, message, cause);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}
