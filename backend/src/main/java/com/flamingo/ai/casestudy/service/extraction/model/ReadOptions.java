package com.flamingo.ai.casestudy.service.extraction.model;

/**
 * Per-read switches decided by the size policy.
 *
 * @param skipImages do not extract images at all
 */
public record ReadOptions(boolean skipImages) {

  public static final ReadOptions FULL = new ReadOptions(false);
  public static final ReadOptions TEXT_ONLY = new ReadOptions(true);
}
