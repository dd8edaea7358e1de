package com.flamingo.ai.casestudy.service.generation;

import static com.flamingo.ai.casestudy.TestDocuments.image;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ImageSelector Tests")
class ImageSelectorTest {

  private ImageSelector selector;

  @BeforeEach
  void setUp() {
    selector = new ImageSelector();
  }

  @Test
  @DisplayName("should return images unchanged when there are at most three")
  void shouldReturnImagesUnchanged_whenAtMostMax() {
    List<ExtractedImage> images =
        List.of(image("a", "Decorative icon"), image("b", "Image 2"), image("c", "Diagram"));

    List<ExtractedImage> selected = selector.select(images, "anything", 3);

    assertThat(selected).containsExactlyElementsOf(images);
  }

  @Test
  @DisplayName("should rank a diagram into the top three")
  void shouldRankDiagramHigh_whenMoreImagesThanMax() {
    List<ExtractedImage> images =
        List.of(
            image("img_0", "Image 1"),
            image("img_1", "Image 2"),
            image("img_2", "Image 3"),
            image("img_3", "Image 4"),
            image("img_4", "Image 5"),
            image("img_5", "Architecture diagram"));

    List<ExtractedImage> selected = selector.select(images, "", 3);

    assertThat(selected).hasSize(3);
    assertThat(selected).extracting(ExtractedImage::id).contains("img_5");
  }

  @Test
  @DisplayName("should push decorative images below generic ones")
  void shouldPenalizeDecorativeImages_whenRanking() {
    List<ExtractedImage> images =
        List.of(
            image("bg", "Background texture"),
            image("g1", "Image 2"),
            image("g2", "Image 3"),
            image("g3", "Image 4"));

    List<ExtractedImage> selected = selector.select(images, "", 3);

    assertThat(selected).extracting(ExtractedImage::id).containsExactly("g1", "g2", "g3");
  }

  @Test
  @DisplayName("should favour the cover slide and caption words found in the narrative")
  void shouldBoostCoverAndNarrativeMatches_whenScoring() {
    double cover = selector.score(image("c", "Slide 1"), 10, "");
    double plain = selector.score(image("p", "Image"), 10, "");
    double matching = selector.score(image("m", "warehouse robots"), 10, "the warehouse robots");

    assertThat(cover - plain).isEqualTo(100.0);
    assertThat(matching - plain).isEqualTo(20.0);
  }

  @Test
  @DisplayName("should keep document order among equal scores")
  void shouldKeepStableOrder_whenScoresTie() {
    List<ExtractedImage> images =
        List.of(
            image("a", "Chart"),
            image("b", "Chart"),
            image("c", "Chart"),
            image("d", "Chart"));

    assertThat(selector.select(images, "", 2))
        .extracting(ExtractedImage::id)
        .containsExactly("a", "b");
  }

  @Test
  @DisplayName("should return an empty list for no images")
  void shouldReturnEmpty_whenNoImages() {
    assertThat(selector.select(List.of(), "text", 3)).isEmpty();
    assertThat(selector.select(null, "text", 3)).isEmpty();
  }
}
