package com.flamingo.ai.casestudy.service.generation;

import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ranks extracted images by likely relevance to a narrative.
 *
 * <p>Scores combine document position, page or slide number hints in the caption, caption words
 * shared with the narrative, and diagram or decoration keywords. Ties keep document order.
 */
@Component
@Slf4j
public class ImageSelector {

  private static final List<String> VALUABLE =
      List.of(
          "diagram", "chart", "graph", "figure", "process", "workflow", "infographic", "results");

  private static final List<String> DECORATIVE =
      List.of("icon", "bullet", "background", "decoration");

  private record Scored(ExtractedImage image, double score) {}

  /**
   * Selects the top images for a narrative.
   *
   * @param images candidate images in document order
   * @param narrativeText narrative to match captions against
   * @param maxImages maximum number of images to return
   * @return the input unchanged when it has at most {@code maxImages} entries, otherwise the best
   *     {@code maxImages} images by descending score
   */
  public List<ExtractedImage> select(
      List<ExtractedImage> images, String narrativeText, int maxImages) {
    if (images == null || images.isEmpty()) {
      return List.of();
    }
    if (images.size() <= maxImages) {
      return List.copyOf(images);
    }

    String narrative = narrativeText != null ? narrativeText.toLowerCase(Locale.ROOT) : "";
    List<Scored> scored = new ArrayList<>(images.size());
    for (int i = 0; i < images.size(); i++) {
      scored.add(new Scored(images.get(i), score(images.get(i), i, narrative)));
    }
    scored.sort(Comparator.comparingDouble(Scored::score).reversed());

    List<ExtractedImage> selected =
        scored.stream().limit(maxImages).map(Scored::image).toList();
    log.debug("Selected {} images from {} available images", selected.size(), images.size());
    return selected;
  }

  /**
   * Scores one image.
   *
   * @param image image to score
   * @param index position in document order
   * @param narrative lower-case narrative text
   * @return relevance score, higher is better
   */
  double score(ExtractedImage image, int index, String narrative) {
    String caption = image.caption().toLowerCase(Locale.ROOT);
    double score = Math.max(0, 100 - index) * 0.5;

    if (caption.contains("slide 1") || caption.contains("page 1") || caption.contains("cover")) {
      score += 100;
    } else if (caption.contains("slide 2") || caption.contains("page 2")) {
      score += 80;
    } else if (mentionsEarlyPage(caption)) {
      score += 60;
    }

    if (!narrative.isEmpty() && !caption.isEmpty()) {
      for (String word : caption.split("\\s+")) {
        if (word.length() > 4 && narrative.contains(word)) {
          score += 10;
        }
      }
    }

    if (VALUABLE.stream().anyMatch(caption::contains)) {
      score += 50;
    }
    if (DECORATIVE.stream().anyMatch(caption::contains)) {
      score -= 50;
    }
    return score;
  }

  private boolean mentionsEarlyPage(String caption) {
    for (int n = 3; n <= 5; n++) {
      if (caption.contains("slide " + n) || caption.contains("page " + n)) {
        return true;
      }
    }
    return false;
  }
}
