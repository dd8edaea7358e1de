package com.flamingo.ai.casestudy.service.generation;

import static com.flamingo.ai.casestudy.TestDocuments.document;
import static com.flamingo.ai.casestudy.TestDocuments.metadata;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.exception.ErrorCategory;
import com.flamingo.ai.casestudy.exception.ResourceExhaustedException;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import com.flamingo.ai.casestudy.service.extraction.model.StructuredContent;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SizeGovernor Tests")
class SizeGovernorTest {

  private static final long MB = 1024L * 1024L;

  private SizeGovernor governor;

  @BeforeEach
  void setUp() {
    governor = new SizeGovernor(new CaseStudyProperties());
  }

  @Test
  @DisplayName("should reject a file above the per-file limit")
  void shouldRejectFile_whenAboveMaxFileSize() {
    assertThatThrownBy(() -> governor.checkFileSize("huge.pdf", 101 * MB))
        .isInstanceOf(ResourceExhaustedException.class)
        .satisfies(
            e ->
                assertThat(((ResourceExhaustedException) e).getCategory())
                    .isEqualTo(ErrorCategory.RESOURCE_EXHAUSTED));
  }

  @Test
  @DisplayName("should reject an upload above the aggregate limit")
  void shouldRejectUpload_whenAggregateTooLarge() {
    governor.checkAggregateSize(200 * MB);

    assertThatThrownBy(() -> governor.checkAggregateSize(201 * MB))
        .isInstanceOf(ResourceExhaustedException.class);
  }

  @Test
  @DisplayName("should read small files fully")
  void shouldReadFully_whenSmallFile() {
    SizeGovernor.ReadPolicy policy = governor.readPolicy(SourceType.PDF, 2 * MB);

    assertThat(policy.options()).isEqualTo(ReadOptions.FULL);
    assertThat(policy.skipGenerativeProcessing()).isFalse();
  }

  @Test
  @DisplayName("should skip images for large PDFs and mark them for heuristic generation")
  void shouldSkipImages_whenLargePdf() {
    SizeGovernor.ReadPolicy policy = governor.readPolicy(SourceType.PDF, 20 * MB);

    assertThat(policy.options()).isEqualTo(ReadOptions.TEXT_ONLY);
    assertThat(policy.skipGenerativeProcessing()).isTrue();
  }

  @Test
  @DisplayName("should keep images for a large presentation below the very-large threshold")
  void shouldKeepImages_whenLargePresentation() {
    SizeGovernor.ReadPolicy policy = governor.readPolicy(SourceType.PPTX, 20 * MB);

    assertThat(policy.options()).isEqualTo(ReadOptions.FULL);
    assertThat(policy.skipGenerativeProcessing()).isTrue();
  }

  @Test
  @DisplayName("should skip images for any very large file")
  void shouldSkipImages_whenVeryLargeFile() {
    assertThat(governor.readPolicy(SourceType.PPTX, 30 * MB).options())
        .isEqualTo(ReadOptions.TEXT_ONLY);
  }

  @Test
  @DisplayName("should cap ingested text only for big files with huge text")
  void shouldApplyIngestCap_whenFileAndTextBothLarge() {
    assertThat(governor.exceedsIngestCap(60 * MB, 1_500_000)).isTrue();
    assertThat(governor.exceedsIngestCap(10 * MB, 1_500_000)).isFalse();
    assertThat(governor.exceedsIngestCap(60 * MB, 500_000)).isFalse();
  }

  @Test
  @DisplayName("should admit a normal document to generation")
  void shouldAdmit_whenDocumentWithinLimits() {
    assertThat(governor.generationRejection(document("Some text worth a story.", SourceType.TXT)))
        .isEmpty();
  }

  @Test
  @DisplayName("should reject generation for flagged, empty or oversized documents")
  void shouldReject_whenDocumentOutsideLimits() {
    ExtractedDocument flagged =
        new ExtractedDocument(
            "text",
            List.of(),
            StructuredContent.empty(),
            metadata(SourceType.PDF, 10).skipGenerativeProcessing(true).build());
    ExtractedDocument empty = document("   ", SourceType.TXT);
    ExtractedDocument oversized = document("a".repeat(250_000), SourceType.TXT);

    assertThat(governor.generationRejection(flagged)).contains("skip_flag");
    assertThat(governor.generationRejection(empty)).contains("empty_text");
    assertThat(governor.generationRejection(oversized)).contains("text_hard_cap");
  }

  @Test
  @DisplayName("should give large inputs a longer attempt timeout")
  void shouldUseLongerTimeout_whenLargeInput() {
    assertThat(governor.isLargeInput("a".repeat(20_001))).isTrue();
    assertThat(governor.isLargeInput("a".repeat(20_000))).isFalse();
    assertThat(governor.attemptTimeout(true)).isEqualTo(Duration.ofSeconds(60));
    assertThat(governor.attemptTimeout(false)).isEqualTo(Duration.ofSeconds(30));
  }
}
