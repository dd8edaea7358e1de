package com.flamingo.ai.casestudy.service.generation.model;

import java.util.List;

/**
 * Narrative sections of a case study before images are attached. Produced by the generative
 * backend or the heuristic generator.
 */
public record CaseStudyDraft(
    String title,
    String challenge,
    String approach,
    String solution,
    String outcomes,
    String summary,
    List<String> keyPoints) {

  public CaseStudyDraft {
    keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
  }

  /** Concatenation of all narrative fields, used to match image captions. */
  public String narrativeText() {
    return String.join(
        " ",
        nullToEmpty(title),
        nullToEmpty(challenge),
        nullToEmpty(approach),
        nullToEmpty(solution),
        nullToEmpty(outcomes),
        nullToEmpty(summary));
  }

  private static String nullToEmpty(String value) {
    return value != null ? value : "";
  }
}
