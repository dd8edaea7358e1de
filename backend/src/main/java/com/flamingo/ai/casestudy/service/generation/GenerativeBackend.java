package com.flamingo.ai.casestudy.service.generation;

import com.flamingo.ai.casestudy.service.generation.model.CaseStudyDraft;

/**
 * A text-completion service able to write a case study draft from document text.
 *
 * <p>Implementations raise a {@link com.flamingo.ai.casestudy.exception.LlmServiceException}
 * subtype describing the failure class: timeout, connection, rate limit, context limit or invalid
 * response.
 */
public interface GenerativeBackend {

  /**
   * Writes a draft.
   *
   * @param content document text, possibly truncated
   * @param audience target audience, {@code general} for none
   * @param largeInput use the concise prompt meant for large inputs
   * @return the parsed draft
   */
  CaseStudyDraft generate(String content, String audience, boolean largeInput);
}
