package com.flamingo.ai.casestudy.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** JSON answer of {@link com.flamingo.ai.casestudy.agent.CaseStudyWriterAgent}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaseStudyResponse(
    String title,
    String challenge,
    String approach,
    String solution,
    String outcomes,
    String summary,
    @JsonProperty("key_points") List<String> keyPoints) {}
