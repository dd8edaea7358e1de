package com.flamingo.ai.casestudy.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Converts case study auxiliary fields to and from their stored JSON form. */
@Component
@Slf4j
@RequiredArgsConstructor
public class CaseStudyAuxiliaryCodec {

  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public String toJson(CaseStudyAuxiliaryFields fields) {
    try {
      return objectMapper.writeValueAsString(
          fields != null ? fields : CaseStudyAuxiliaryFields.empty());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize case study fields", e);
    }
  }

  /**
   * Reads stored fields. Blank or unreadable input yields empty lists.
   *
   * @param json stored JSON object
   * @return the decoded fields
   */
  public CaseStudyAuxiliaryFields fromJson(String json) {
    if (json == null || json.isBlank()) {
      return CaseStudyAuxiliaryFields.empty();
    }
    try {
      return objectMapper.readValue(json, CaseStudyAuxiliaryFields.class);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize case study fields: {}", e.getMessage());
      return CaseStudyAuxiliaryFields.empty();
    }
  }

  /** Encodes a bare string list, as stored for the key points column. */
  public String listToJson(List<String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize string list", e);
    }
  }

  public List<String> listFromJson(String json) {
    if (json == null || json.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return objectMapper.readValue(json, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize string list: {}", e.getMessage());
      return Collections.emptyList();
    }
  }
}
