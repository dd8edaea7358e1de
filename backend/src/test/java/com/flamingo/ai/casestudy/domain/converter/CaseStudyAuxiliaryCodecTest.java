package com.flamingo.ai.casestudy.domain.converter;

import static com.flamingo.ai.casestudy.TestDocuments.image;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudy;
import com.flamingo.ai.casestudy.service.generation.model.GenerationMode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CaseStudyAuxiliaryCodec Tests")
class CaseStudyAuxiliaryCodecTest {

  private CaseStudyAuxiliaryCodec codec;

  @BeforeEach
  void setUp() {
    codec = new CaseStudyAuxiliaryCodec(new ObjectMapper());
  }

  @Test
  @DisplayName("should write snake_case field names")
  void shouldWriteSnakeCaseNames_whenSerializing() {
    String json =
        codec.toJson(new CaseStudyAuxiliaryFields(List.of("Fast"), List.of("pdf_page_0")));

    assertThat(json).isEqualTo("{\"key_points\":[\"Fast\"],\"image_ids\":[\"pdf_page_0\"]}");
  }

  @Test
  @DisplayName("should keep key points and image ids of a case study through storage")
  void shouldPreserveFields_whenStoredAndLoaded() {
    CaseStudy caseStudy =
        new CaseStudy(
            "Title",
            "c",
            "a",
            "s",
            "o",
            "sum",
            List.of("First point", "Second point"),
            List.of(image("pptx_image_2", "Chart"), image("pptx_image_0", "Cover")),
            "general",
            GenerationMode.FALLBACK);

    CaseStudyAuxiliaryFields loaded =
        codec.fromJson(codec.toJson(CaseStudyAuxiliaryFields.of(caseStudy)));

    assertThat(loaded.keyPoints()).containsExactly("First point", "Second point");
    assertThat(loaded.imageIds()).containsExactly("pptx_image_2", "pptx_image_0");
  }

  @Test
  @DisplayName("should read empty lists from blank or unreadable input")
  void shouldReturnEmpty_whenInputBlankOrBroken() {
    assertThat(codec.fromJson(null)).isEqualTo(CaseStudyAuxiliaryFields.empty());
    assertThat(codec.fromJson("{broken")).isEqualTo(CaseStudyAuxiliaryFields.empty());
    assertThat(codec.fromJson("{\"key_points\":null}").keyPoints()).isEmpty();
  }

  @Test
  @DisplayName("should encode bare lists and decode them back")
  void shouldHandleBareLists_whenUsedForSingleColumn() {
    assertThat(codec.listToJson(List.of())).isNull();
    assertThat(codec.listFromJson(codec.listToJson(List.of("a", "b")))).containsExactly("a", "b");
    assertThat(codec.listFromJson("")).isEmpty();
  }
}
