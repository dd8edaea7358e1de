package com.flamingo.ai.casestudy.exception;

/** Exception thrown when a source file does not exist. */
public class DocumentNotFoundException extends DocumentProcessingException {

  public DocumentNotFoundException(String source) {
    super(
        ErrorCategory.DOCUMENT_NOT_FOUND,
        "Source not found: " + source,
        "The uploaded file could not be found. Please upload it again.");
  }
}
