package com.flamingo.ai.casestudy.exception;

/** Exception thrown when a size or memory budget is exceeded. */
public class ResourceExhaustedException extends DocumentProcessingException {

  private final long actual;
  private final long limit;

  public ResourceExhaustedException(String what, long actual, long limit) {
    super(
        ErrorCategory.RESOURCE_EXHAUSTED,
        String.format("%s exceeds limit: %d > %d bytes", what, actual, limit),
        String.format(
            "%s is too large (%.1f MB, limit %.0f MB). Try again with a smaller file.",
            what, actual / 1024.0 / 1024.0, limit / 1024.0 / 1024.0));
    this.actual = actual;
    this.limit = limit;
  }

  public ResourceExhaustedException(String message, Throwable cause) {
    super(
        ErrorCategory.RESOURCE_EXHAUSTED,
        message,
        "Not enough memory to process this document. Try with a smaller file.",
        cause);
    this.actual = -1;
    this.limit = -1;
  }

  public long getActual() {
    return actual;
  }

  public long getLimit() {
    return limit;
  }
}
