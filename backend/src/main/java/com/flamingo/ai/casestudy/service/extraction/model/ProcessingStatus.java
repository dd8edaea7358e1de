package com.flamingo.ai.casestudy.service.extraction.model;

/** Outcome of reading one source. */
public enum ProcessingStatus {
  SUCCESS,
  ERROR
}
