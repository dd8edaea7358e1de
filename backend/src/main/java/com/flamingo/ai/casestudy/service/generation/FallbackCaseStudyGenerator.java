package com.flamingo.ai.casestudy.service.generation;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.service.extraction.StructureExtractor;
import com.flamingo.ai.casestudy.service.extraction.model.DocumentSection;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.extraction.model.StructuredContent;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudy;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudyDraft;
import com.flamingo.ai.casestudy.service.generation.model.GenerationMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a case study from structural heuristics alone, without any external call.
 *
 * <p>Presentations are segmented into title buckets and matched to narrative sections by keyword.
 * Other documents map their sections by heading keyword, or by position when no heading matches.
 * Anything that cannot be derived keeps a fixed placeholder, so the result is always complete.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FallbackCaseStudyGenerator {

  static final String DEFAULT_TITLE = "Document Analysis Report";
  static final String DEFAULT_CHALLENGE = "Analysis of the provided document content.";
  static final String DEFAULT_APPROACH = "Document processing and content extraction.";
  static final String DEFAULT_SOLUTION =
      "Automated extraction of key information from the document.";
  static final String DEFAULT_OUTCOMES = "Generated report based on document analysis.";
  static final String DEFAULT_SUMMARY =
      "This report was automatically generated from the document content.";
  static final List<String> DEFAULT_KEY_POINTS =
      List.of(
          "Document processed successfully",
          "Content extracted and analyzed",
          "Report generated from content");

  private static final int SECTION_CAP = 800;
  private static final int SUMMARY_CAP = 400;
  private static final int SUMMARY_PART_CHARS = 150;
  private static final int TITLE_MAX_LENGTH = 60;
  private static final int TITLE_MAX_WORDS = 10;
  private static final int POSITIONAL_FILL = 3;

  private static final List<String> FOOTER_HINTS =
      List.of("confidential", "page", "copyright", "©", "all rights reserved", "footer");

  private static final List<String> GENERIC_TITLES =
      List.of("agenda", "content", "overview", "thank");

  /** Narrative sections a bucket of content can be assigned to. */
  enum Part {
    CHALLENGE("challenge", "problem", "issue", "background", "overview", "introduction"),
    APPROACH("approach", "methodology", "strategy", "process", "plan"),
    SOLUTION("solution", "implementation", "platform", "technology", "product"),
    OUTCOMES("outcomes", "results", "benefits", "impact", "conclusion", "success");

    private final List<String> keywords;

    Part(String... keywords) {
      this.keywords = List.of(keywords);
    }

    boolean matches(String title) {
      String lower = title.toLowerCase(Locale.ROOT);
      return keywords.stream().anyMatch(lower::contains);
    }

    static Part byKeyword(String title) {
      for (Part part : values()) {
        if (part.matches(title)) {
          return part;
        }
      }
      return null;
    }
  }

  private record Bucket(String title, List<String> lines) {}

  private final ImageSelector imageSelector;
  private final CaseStudyProperties properties;

  /**
   * Generates a heuristic case study.
   *
   * @param document extracted document, never modified
   * @param audience target audience
   * @return a complete case study in {@link GenerationMode#FALLBACK} mode
   */
  public CaseStudy generate(ExtractedDocument document, String audience) {
    log.info("Using fallback case study generation for {}", document.metadata().sourceName());
    CaseStudyDraft draft = draft(document);
    List<ExtractedImage> images =
        imageSelector.select(
            document.images(), draft.narrativeText(), properties.getGeneration().getMaxImages());
    return new CaseStudy(
        draft.title(),
        draft.challenge(),
        draft.approach(),
        draft.solution(),
        draft.outcomes(),
        draft.summary(),
        draft.keyPoints(),
        images.stream().map(img -> img.withSelectedForNarrative(true)).toList(),
        audience,
        GenerationMode.FALLBACK);
  }

  /**
   * Derives the narrative sections of a heuristic case study.
   *
   * @param document extracted document
   * @return the draft, with placeholders where nothing could be derived
   */
  CaseStudyDraft draft(ExtractedDocument document) {
    StructuredContent structured = document.structuredContent();
    Map<Part, String> parts = new EnumMap<>(Part.class);
    parts.put(Part.CHALLENGE, DEFAULT_CHALLENGE);
    parts.put(Part.APPROACH, DEFAULT_APPROACH);
    parts.put(Part.SOLUTION, DEFAULT_SOLUTION);
    parts.put(Part.OUTCOMES, DEFAULT_OUTCOMES);
    String summary = DEFAULT_SUMMARY;
    List<String> keyPoints = structured.keyPoints();
    boolean presentationMapped = false;

    if (document.sourceType() != null && document.sourceType().isPresentation()) {
      List<Bucket> buckets = new ArrayList<>();
      List<String> slideTitles = new ArrayList<>();
      segmentSlides(document.text(), buckets, slideTitles);
      Map<Part, List<String>> assigned = assignBuckets(buckets);

      for (Map.Entry<Part, List<String>> entry : assigned.entrySet()) {
        if (!entry.getValue().isEmpty()) {
          parts.put(entry.getKey(), cap(String.join(" ", entry.getValue()), SECTION_CAP));
          presentationMapped = true;
        }
      }

      List<String> summaryParts = new ArrayList<>();
      for (Part part : List.of(Part.CHALLENGE, Part.SOLUTION)) {
        List<String> lines = assigned.get(part);
        if (!lines.isEmpty()) {
          summaryParts.add(String.join(" ", lines.subList(0, Math.min(2, lines.size()))));
        }
      }
      if (!summaryParts.isEmpty()) {
        summary = cap(String.join(" ", summaryParts), SUMMARY_CAP);
      }

      List<String> candidates = presentationKeyPoints(slideTitles, assigned);
      if (!candidates.isEmpty()) {
        keyPoints =
            candidates.stream().filter(k -> k.length() > 15 && k.length() < 100).limit(5).toList();
      }
    }

    if (!presentationMapped && !structured.sections().isEmpty()) {
      summary = mapSections(structured.sections(), parts);
    }

    return new CaseStudyDraft(
        structured.titleIfPresent().orElse(DEFAULT_TITLE),
        parts.get(Part.CHALLENGE),
        parts.get(Part.APPROACH),
        parts.get(Part.SOLUTION),
        parts.get(Part.OUTCOMES),
        summary,
        keyPoints.isEmpty() ? DEFAULT_KEY_POINTS : keyPoints);
  }

  // ---- presentation heuristics ----

  private void segmentSlides(String text, List<Bucket> buckets, List<String> slideTitles) {
    Bucket current = null;
    for (String raw : text.split("\n")) {
      String line = raw.strip();
      if (line.isEmpty() || isFooter(line)) {
        continue;
      }
      if (looksLikeTitle(line)) {
        slideTitles.add(line);
        current = new Bucket(line, new ArrayList<>());
        buckets.add(current);
      } else if (current != null && !isShortUntitled(line)) {
        current.lines().add(line);
      }
    }
  }

  private boolean isShortUntitled(String line) {
    // short lines that fail the title test are not content either
    return line.length() < TITLE_MAX_LENGTH && !line.endsWith(".");
  }

  private Map<Part, List<String>> assignBuckets(List<Bucket> buckets) {
    Map<Part, List<String>> assigned = new EnumMap<>(Part.class);
    for (Part part : Part.values()) {
      assigned.put(part, new ArrayList<>());
    }
    for (Bucket bucket : buckets) {
      Part part = Part.byKeyword(bucket.title());
      if (part == null) {
        part = firstUnfilled(assigned);
      }
      assigned.get(part).addAll(bucket.lines());
    }
    return assigned;
  }

  private Part firstUnfilled(Map<Part, List<String>> assigned) {
    for (Part part : List.of(Part.CHALLENGE, Part.APPROACH, Part.SOLUTION)) {
      if (assigned.get(part).size() < POSITIONAL_FILL) {
        return part;
      }
    }
    return Part.OUTCOMES;
  }

  private List<String> presentationKeyPoints(
      List<String> slideTitles, Map<Part, List<String>> assigned) {
    List<String> candidates = new ArrayList<>();
    if (slideTitles.size() > 3) {
      slideTitles.stream()
          .filter(t -> GENERIC_TITLES.stream().noneMatch(t.toLowerCase(Locale.ROOT)::contains))
          .limit(5)
          .forEach(candidates::add);
    }
    for (Part part : List.of(Part.CHALLENGE, Part.SOLUTION, Part.OUTCOMES)) {
      for (String line : assigned.get(part)) {
        if (line.startsWith("•") || line.startsWith("-") || line.startsWith("*")) {
          candidates.add(stripBullet(line));
        }
      }
    }
    return candidates;
  }

  private boolean isFooter(String line) {
    String lower = line.toLowerCase(Locale.ROOT);
    return FOOTER_HINTS.stream().anyMatch(lower::contains);
  }

  private boolean looksLikeTitle(String line) {
    if (line.length() >= TITLE_MAX_LENGTH || line.endsWith(".")) {
      return false;
    }
    String[] words = line.split("\\s+");
    if (words.length > TITLE_MAX_WORDS) {
      return false;
    }
    if (isTitleCase(line) || isUpperCase(line)) {
      return true;
    }
    for (String word : words) {
      if (word.length() > 1 && Character.isUpperCase(word.charAt(0))) {
        return true;
      }
    }
    return false;
  }

  private static boolean isTitleCase(String text) {
    boolean cased = false;
    boolean previousCased = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
        if (previousCased) {
          return false;
        }
        previousCased = true;
        cased = true;
      } else if (Character.isLowerCase(c)) {
        if (!previousCased) {
          return false;
        }
        previousCased = true;
        cased = true;
      } else {
        previousCased = false;
      }
    }
    return cased;
  }

  private static boolean isUpperCase(String text) {
    boolean cased = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isLowerCase(c)) {
        return false;
      }
      if (Character.isUpperCase(c)) {
        cased = true;
      }
    }
    return cased;
  }

  private static String stripBullet(String line) {
    int start = 0;
    while (start < line.length() && "•-* ".indexOf(line.charAt(start)) >= 0) {
      start++;
    }
    return line.substring(start);
  }

  // ---- section heuristics ----

  private String mapSections(List<DocumentSection> sections, Map<Part, String> parts) {
    List<DocumentSection> nonEmpty =
        sections.stream().filter(s -> !s.content().isEmpty()).toList();

    Map<Part, List<String>> byKeyword = new EnumMap<>(Part.class);
    for (DocumentSection section : nonEmpty) {
      // the implicit lead-in section carries no heading of its own
      if (StructureExtractor.INTRODUCTION.equals(section.title())) {
        continue;
      }
      Part part = Part.byKeyword(section.title());
      if (part != null) {
        byKeyword.computeIfAbsent(part, p -> new ArrayList<>()).add(section.content().strip());
      }
    }

    if (!byKeyword.isEmpty()) {
      log.debug("Mapped {} narrative parts by section heading", byKeyword.size());
      byKeyword.forEach(
          (part, bodies) -> parts.put(part, cap(String.join(" ", bodies), SECTION_CAP)));
    } else {
      List<Part> order = List.of(Part.values());
      for (int i = 0; i < Math.min(order.size(), nonEmpty.size()); i++) {
        parts.put(order.get(i), cap(nonEmpty.get(i).content().strip(), SECTION_CAP));
      }
    }

    List<String> summaryParts = new ArrayList<>();
    for (int i = 0; i < Math.min(3, nonEmpty.size()); i++) {
      summaryParts.add(cap(nonEmpty.get(i).content(), SUMMARY_PART_CHARS));
    }
    return String.join(" ", summaryParts);
  }

  private static String cap(String text, int max) {
    return text.length() <= max ? text : text.substring(0, max);
  }
}
