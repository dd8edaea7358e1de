package com.flamingo.ai.casestudy.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.casestudy.agent.CaseStudyWriterAgent;
import com.flamingo.ai.casestudy.agent.dto.CaseStudyResponse;
import com.flamingo.ai.casestudy.config.LangChain4jConfig;
import com.flamingo.ai.casestudy.exception.BackendInvalidResponseException;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudyDraft;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * {@link GenerativeBackend} backed by the LangChain4j {@link CaseStudyWriterAgent}.
 *
 * <p>Only present when an API key is configured.
 */
@Component
@ConditionalOnExpression(LangChain4jConfig.BACKEND_CONFIGURED)
@RequiredArgsConstructor
@Slf4j
public class AgentGenerativeBackend implements GenerativeBackend {

  static final String PLACEHOLDER = "Not provided.";

  private final CaseStudyWriterAgent agent;
  private final ObjectMapper objectMapper;
  private final BackendErrorClassifier errorClassifier;

  @Override
  public CaseStudyDraft generate(String content, String audience, boolean largeInput) {
    String audienceHint =
        audience == null || "general".equalsIgnoreCase(audience)
            ? ""
            : "Target audience: " + audience + ".";
    String json;
    try {
      json =
          largeInput
              ? agent.writeConcise(audienceHint, content)
              : agent.write(audienceHint, content);
    } catch (RuntimeException e) {
      throw errorClassifier.classify(e);
    }
    log.debug("Received case study response ({} chars)", json != null ? json.length() : 0);
    return parse(json);
  }

  /**
   * Parses the agent's JSON answer. Missing narrative fields are replaced by a placeholder.
   *
   * @param json raw answer
   * @return the draft
   * @throws BackendInvalidResponseException if the answer is empty or not a JSON object
   */
  CaseStudyDraft parse(String json) {
    if (json == null || json.isBlank()) {
      throw new BackendInvalidResponseException("Empty response from backend");
    }
    CaseStudyResponse response;
    try {
      response = objectMapper.readValue(json, CaseStudyResponse.class);
    } catch (JsonProcessingException e) {
      throw new BackendInvalidResponseException("Malformed case study JSON: " + e.getMessage(), e);
    }
    if (response == null) {
      throw new BackendInvalidResponseException("Backend returned JSON null");
    }
    return new CaseStudyDraft(
        orPlaceholder(response.title(), "Case Study"),
        orPlaceholder(response.challenge(), PLACEHOLDER),
        orPlaceholder(response.approach(), PLACEHOLDER),
        orPlaceholder(response.solution(), PLACEHOLDER),
        orPlaceholder(response.outcomes(), PLACEHOLDER),
        orPlaceholder(response.summary(), PLACEHOLDER),
        response.keyPoints() != null
            ? response.keyPoints().stream().filter(p -> p != null && !p.isBlank()).toList()
            : List.of());
  }

  private static String orPlaceholder(String value, String placeholder) {
    return value != null && !value.isBlank() ? value : placeholder;
  }
}
