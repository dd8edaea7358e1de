package com.flamingo.ai.casestudy.exception;

/** The prompt exceeded the model's context window. */
public class BackendContextLimitException extends LlmServiceException {

  public BackendContextLimitException(String message, Throwable cause) {
    super(ErrorCategory.LLM_CONTEXT_LIMIT, message, cause);
  }
}
