package com.flamingo.ai.casestudy.exception;

/** The backend answered, but not with the expected JSON structure. */
public class BackendInvalidResponseException extends LlmServiceException {

  public BackendInvalidResponseException(String message) {
    super(ErrorCategory.LLM_INVALID_RESPONSE, message, null);
  }

  public BackendInvalidResponseException(String message, Throwable cause) {
    super(ErrorCategory.LLM_INVALID_RESPONSE, message, cause);
  }
}
