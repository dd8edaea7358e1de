package com.flamingo.ai.casestudy.service.generation.model;

import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import java.util.List;
import java.util.Objects;

/**
 * Final, immutable case study produced by one generation request.
 *
 * @param title case study title
 * @param challenge problem statement
 * @param approach how the problem was tackled
 * @param solution what was delivered
 * @param outcomes results and benefits
 * @param summary executive summary
 * @param keyPoints short highlights
 * @param images up to three ranked images, flagged as selected
 * @param audience audience the narrative was written for
 * @param generationMode whether the backend or the heuristic generator wrote it
 */
public record CaseStudy(
    String title,
    String challenge,
    String approach,
    String solution,
    String outcomes,
    String summary,
    List<String> keyPoints,
    List<ExtractedImage> images,
    String audience,
    GenerationMode generationMode) {

  public CaseStudy {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(challenge, "challenge");
    Objects.requireNonNull(approach, "approach");
    Objects.requireNonNull(solution, "solution");
    Objects.requireNonNull(outcomes, "outcomes");
    Objects.requireNonNull(summary, "summary");
    keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
    images = images != null ? List.copyOf(images) : List.of();
    audience = audience != null ? audience : "general";
  }

  /** Image ids in ranked order. */
  public List<String> imageIds() {
    return images.stream().map(ExtractedImage::id).toList();
  }
}
