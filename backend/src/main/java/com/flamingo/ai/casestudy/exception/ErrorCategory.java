package com.flamingo.ai.casestudy.exception;

/** Machine-readable error categories surfaced to callers. */
public enum ErrorCategory {
  DOCUMENT_NOT_FOUND("DOCUMENT_001"),
  UNSUPPORTED_FORMAT("DOCUMENT_002"),
  CORRUPT_INPUT("DOCUMENT_003"),
  DECODE_FAILURE("DOCUMENT_004"),
  RESOURCE_EXHAUSTED("DOCUMENT_005"),
  LLM_UNAVAILABLE("LLM_001"),
  LLM_RATE_LIMITED("LLM_002"),
  LLM_TIMEOUT("LLM_003"),
  LLM_CONTEXT_LIMIT("LLM_004"),
  LLM_INVALID_RESPONSE("LLM_005");

  private final String code;

  ErrorCategory(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
