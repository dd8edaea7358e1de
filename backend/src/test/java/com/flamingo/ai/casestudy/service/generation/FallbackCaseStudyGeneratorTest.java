package com.flamingo.ai.casestudy.service.generation;

import static com.flamingo.ai.casestudy.TestDocuments.document;
import static com.flamingo.ai.casestudy.TestDocuments.image;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudy;
import com.flamingo.ai.casestudy.service.generation.model.GenerationMode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FallbackCaseStudyGenerator Tests")
class FallbackCaseStudyGeneratorTest {

  private static final String DECK =
      """
      The Challenge
      Our legacy warehouse system could not keep up with demand growth.
      - manual picking caused frequent order errors across every single site.
      Our Solution
      We deployed an automated robotics platform across all sites.
      Results
      Order accuracy improved to 99.9 percent within six months.
      Page 3 of 10
      """;

  private FallbackCaseStudyGenerator generator;

  @BeforeEach
  void setUp() {
    generator = new FallbackCaseStudyGenerator(new ImageSelector(), new CaseStudyProperties());
  }

  @Test
  @DisplayName("should produce placeholders for an empty document")
  void shouldUseDefaults_whenDocumentEmpty() {
    CaseStudy result = generator.generate(document("", SourceType.TXT), "general");

    assertThat(result.title()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_TITLE);
    assertThat(result.challenge()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_CHALLENGE);
    assertThat(result.approach()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_APPROACH);
    assertThat(result.solution()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_SOLUTION);
    assertThat(result.outcomes()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_OUTCOMES);
    assertThat(result.summary()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_SUMMARY);
    assertThat(result.keyPoints()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_KEY_POINTS);
    assertThat(result.generationMode()).isEqualTo(GenerationMode.FALLBACK);
  }

  @Test
  @DisplayName("should map sections by heading keyword and keep placeholder key points")
  void shouldMapSectionsByKeyword_whenBodiesAreShort() {
    String text = "Challenge:\nshort\nSolution:\nshort2\nResults:\nok";

    CaseStudy result = generator.generate(document(text, SourceType.TXT), "general");

    assertThat(result.challenge()).isEqualTo("short");
    assertThat(result.approach()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_APPROACH);
    assertThat(result.solution()).isEqualTo("short2");
    assertThat(result.outcomes()).isEqualTo("ok");
    assertThat(result.keyPoints()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_KEY_POINTS);
  }

  @Test
  @DisplayName("should map sections by position when no heading matches a keyword")
  void shouldMapSectionsByPosition_whenNoKeywordMatches() {
    String text = "# One\nalpha body\n# Two\nbeta body\n# Three\ngamma body\n";

    CaseStudy result = generator.generate(document(text, SourceType.DOCX), "general");

    assertThat(result.challenge()).isEqualTo("alpha body");
    assertThat(result.approach()).isEqualTo("beta body");
    assertThat(result.solution()).isEqualTo("gamma body");
    assertThat(result.outcomes()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_OUTCOMES);
    assertThat(result.summary()).contains("alpha body", "beta body", "gamma body");
  }

  @Test
  @DisplayName("should map by position when a title line precedes the first heading")
  void shouldMapSectionsByPosition_whenLeadingTitleLine() {
    String text =
        "Acme Rollout Report\n# Phase One\nalpha body\n# Phase Two\nbeta body\n"
            + "# Phase Three\ngamma body\n";

    CaseStudy result = generator.generate(document(text, SourceType.DOCX), "general");

    assertThat(result.title()).isEqualTo("Acme Rollout Report");
    assertThat(result.challenge()).isEqualTo("Acme Rollout Report");
    assertThat(result.approach()).isEqualTo("alpha body");
    assertThat(result.solution()).isEqualTo("beta body");
    assertThat(result.outcomes()).isEqualTo("gamma body");
  }

  @Test
  @DisplayName("should ignore the lead-in text when matching headings by keyword")
  void shouldMapSectionsByKeyword_whenLeadingTitleLine() {
    String text = "Acme Rollout Report\nChallenge:\nstock outs\nOutcomes:\nfewer stock outs\n";

    CaseStudy result = generator.generate(document(text, SourceType.TXT), "general");

    assertThat(result.challenge()).isEqualTo("stock outs");
    assertThat(result.outcomes()).isEqualTo("fewer stock outs");
  }

  @Test
  @DisplayName("should bucket slide text under titles and match buckets to sections")
  void shouldBucketSlides_whenPresentation() {
    CaseStudy result = generator.generate(document(DECK, SourceType.PPTX), "executives");

    assertThat(result.challenge())
        .startsWith("Our legacy warehouse system")
        .contains("manual picking");
    assertThat(result.solution())
        .isEqualTo("We deployed an automated robotics platform across all sites.");
    assertThat(result.outcomes()).startsWith("Order accuracy improved");
    assertThat(result.approach()).isEqualTo(FallbackCaseStudyGenerator.DEFAULT_APPROACH);
    assertThat(result.summary()).contains("legacy warehouse", "robotics platform");
    assertThat(result.keyPoints())
        .containsExactly(
            "manual picking caused frequent order errors across every single site.");
    assertThat(result.audience()).isEqualTo("executives");
  }

  @Test
  @DisplayName("should skip footer lines in slide text")
  void shouldSkipFooters_whenPresentation() {
    CaseStudy result = generator.generate(document(DECK, SourceType.PPTX), "general");

    assertThat(
            List.of(result.challenge(), result.solution(), result.outcomes(), result.summary()))
        .noneMatch(field -> field.contains("Page 3 of 10"));
  }

  @Test
  @DisplayName("should cap section bodies at 800 characters")
  void shouldCapSectionBodies_whenContentLong() {
    String text = "Challenge:\n" + "word ".repeat(400) + "\n";

    CaseStudy result = generator.generate(document(text, SourceType.TXT), "general");

    assertThat(result.challenge()).hasSize(800);
  }

  @Test
  @DisplayName("should attach at most three selected images")
  void shouldAttachSelectedImages_whenManyAvailable() {
    List<ExtractedImage> images =
        List.of(
            image("i0", "Image 1"),
            image("i1", "Image 2"),
            image("i2", "Image 3"),
            image("i3", "Image 4"),
            image("i4", "Process diagram"));

    CaseStudy result = generator.generate(document(DECK, SourceType.PPTX, images), "general");

    assertThat(result.images()).hasSize(3).allMatch(ExtractedImage::selectedForNarrative);
    assertThat(result.imageIds()).contains("i4");
  }
}
