package com.flamingo.ai.casestudy.exception;

import java.util.List;

/** Exception thrown when a text file cannot be decoded with any configured encoding. */
public class DecodeFailureException extends DocumentProcessingException {

  public DecodeFailureException(String fileName, List<String> triedEncodings) {
    super(
        ErrorCategory.DECODE_FAILURE,
        "Failed to decode " + fileName + " with any of " + triedEncodings,
        "The text file uses an unrecognised character encoding. Please save it as UTF-8.");
  }
}
