package com.flamingo.ai.casestudy.domain.converter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudy;
import java.util.List;

/**
 * Parts of a case study stored as JSON next to its text columns.
 *
 * @param keyPoints short highlights
 * @param imageIds ids of the selected images, in ranked order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaseStudyAuxiliaryFields(
    @JsonProperty("key_points") List<String> keyPoints,
    @JsonProperty("image_ids") List<String> imageIds) {

  public CaseStudyAuxiliaryFields {
    keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
    imageIds = imageIds != null ? List.copyOf(imageIds) : List.of();
  }

  public static CaseStudyAuxiliaryFields of(CaseStudy caseStudy) {
    return new CaseStudyAuxiliaryFields(caseStudy.keyPoints(), caseStudy.imageIds());
  }

  public static CaseStudyAuxiliaryFields empty() {
    return new CaseStudyAuxiliaryFields(List.of(), List.of());
  }
}
