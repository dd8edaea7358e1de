package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.service.extraction.model.DocumentEntities;
import com.flamingo.ai.casestudy.service.extraction.model.DocumentSection;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import com.flamingo.ai.casestudy.service.extraction.model.StructuredContent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives a {@link StructuredContent} outline from raw document text with line and regex
 * heuristics.
 *
 * <p>The extraction is a pure function of the text: identical input always yields an equal
 * result.
 *
 * <ul>
 *   <li><strong>Sections</strong>: a stripped line is a heading when it fully matches one of the
 *       heading patterns (markdown prefix, numeric outline, {@code Chapter N}, trailing colon,
 *       all caps). Every other line is appended to the current section. Text before the first
 *       heading belongs to an implicit {@code Introduction} section; empty sections are dropped.
 *   <li><strong>Entities</strong>: dates, organisations with a legal suffix, honorific-prefixed
 *       names.
 *   <li><strong>Key points</strong>: short section bodies, topped up with first sentences of long
 *       sections, at most {@value StructuredContent#MAX_KEY_POINTS}.
 * </ul>
 */
@Component
@Slf4j
public class StructureExtractor {

  /** Title given to content that precedes the first heading. */
  public static final String INTRODUCTION = "Introduction";

  private static final List<Pattern> HEADING_PATTERNS =
      List.of(
          Pattern.compile("#+\\s+(.+)"),
          Pattern.compile("(\\d+\\.[\\d.]*\\s+.+)"),
          Pattern.compile("(Chapter \\d+:?.*)"),
          Pattern.compile("(.*:)"),
          Pattern.compile("([A-Z][A-Z\\s]+)"));

  private static final List<Pattern> DATE_PATTERNS =
      List.of(
          Pattern.compile("\\d{1,2}/\\d{1,2}/\\d{2,4}"),
          Pattern.compile("\\d{1,2}-\\d{1,2}-\\d{2,4}"),
          Pattern.compile(
              "\\b(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]* \\d{1,2},? \\d{4}\\b"));

  private static final Pattern ORGANIZATION =
      Pattern.compile(
          "\\b([A-Z][A-Za-z]+ (?:Inc|LLC|Ltd|Corporation|Corp|Company|Co|Group|Partners"
              + "|Technologies|Solutions|Systems|Associates)\\b)");

  private static final Pattern PERSON =
      Pattern.compile("\\b(?:Mr|Ms|Mrs|Dr|Prof)\\. ([A-Z][a-z]+ [A-Z][a-z]+)\\b");

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

  private static final Pattern WORD =
      Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

  private static final int MIN_TEXT_LENGTH = 10;
  private static final int SHORT_SECTION_MAX = 200;
  private static final int TOP_UP_TARGET = 3;
  private static final int TOP_UP_CAP = 5;

  /**
   * Extracts the outline of a document.
   *
   * @param text raw document text, may be {@code null}
   * @param sourceType format the text came from
   * @return structured content, empty when the text has fewer than ten non-blank characters
   */
  public StructuredContent extract(String text, SourceType sourceType) {
    if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
      return StructuredContent.empty();
    }

    String[] lines = text.split("\n", -1);
    String title = firstNonEmptyLine(lines);
    List<DocumentSection> sections = splitSections(lines);
    DocumentEntities entities = extractEntities(text);
    List<String> keyPoints = extractKeyPoints(sections);

    log.debug(
        "Structured {} text: {} sections, {} key points",
        sourceType,
        sections.size(),
        keyPoints.size());
    return new StructuredContent(title, sections, keyPoints, entities);
  }

  /**
   * Counts word tokens ({@code \b\w+\b}) in a text.
   *
   * @param text text to count, may be {@code null}
   * @return number of words
   */
  public static int countWords(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    Matcher matcher = WORD.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  // ---- private helpers ----

  private String firstNonEmptyLine(String[] lines) {
    for (String line : lines) {
      String stripped = line.strip();
      if (!stripped.isEmpty()) {
        return stripped;
      }
    }
    return null;
  }

  private List<DocumentSection> splitSections(String[] lines) {
    List<DocumentSection> sections = new ArrayList<>();
    String currentTitle = INTRODUCTION;
    StringBuilder currentContent = new StringBuilder();

    for (String line : lines) {
      String stripped = line.strip();
      if (isHeading(stripped)) {
        if (!currentContent.toString().isBlank()) {
          sections.add(new DocumentSection(currentTitle, currentContent.toString()));
        }
        currentTitle = stripped;
        currentContent.setLength(0);
      } else {
        currentContent.append(line).append("\n");
      }
    }
    if (!currentContent.toString().isBlank()) {
      sections.add(new DocumentSection(currentTitle, currentContent.toString()));
    }
    return sections;
  }

  private boolean isHeading(String stripped) {
    for (Pattern pattern : HEADING_PATTERNS) {
      if (pattern.matcher(stripped).matches()) {
        return true;
      }
    }
    return false;
  }

  private DocumentEntities extractEntities(String text) {
    Set<String> dates = new LinkedHashSet<>();
    for (Pattern pattern : DATE_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        dates.add(matcher.group());
      }
    }
    return new DocumentEntities(
        findGroups(ORGANIZATION, text), findGroups(PERSON, text), unmodifiable(dates));
  }

  private Set<String> findGroups(Pattern pattern, String text) {
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      found.add(matcher.group(1));
    }
    return unmodifiable(found);
  }

  private Set<String> unmodifiable(Set<String> values) {
    return Collections.unmodifiableSet(values);
  }

  private List<String> extractKeyPoints(List<DocumentSection> sections) {
    List<String> keyPoints = new ArrayList<>();
    for (DocumentSection section : sections) {
      String body = section.content().strip();
      if (body.length() > MIN_TEXT_LENGTH && body.length() < SHORT_SECTION_MAX) {
        keyPoints.add(body.replace("\n", " "));
      }
    }

    if (keyPoints.size() < TOP_UP_TARGET) {
      for (DocumentSection section : sections) {
        if (section.content().length() > SHORT_SECTION_MAX) {
          String firstSentence = SENTENCE_BOUNDARY.split(section.content(), 2)[0];
          if (firstSentence.length() > MIN_TEXT_LENGTH) {
            keyPoints.add(firstSentence);
          }
        }
        if (keyPoints.size() >= TOP_UP_CAP) {
          break;
        }
      }
    }

    return keyPoints.size() > StructuredContent.MAX_KEY_POINTS
        ? keyPoints.subList(0, StructuredContent.MAX_KEY_POINTS)
        : keyPoints;
  }
}
