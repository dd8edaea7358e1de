package com.flamingo.ai.casestudy.exception;

/** Exception thrown for file types no reader handles. */
public class UnsupportedFormatException extends DocumentProcessingException {

  private final String extension;

  public UnsupportedFormatException(String extension) {
    super(
        ErrorCategory.UNSUPPORTED_FORMAT,
        "Unsupported file extension: " + extension,
        "This file type is not supported. Please upload a PDF, Word, PowerPoint or text file.");
    this.extension = extension;
  }

  public String getExtension() {
    return extension;
  }
}
