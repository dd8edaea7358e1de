package com.flamingo.ai.casestudy.service.generation;

import com.flamingo.ai.casestudy.service.extraction.model.DocumentSection;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Content-preserving truncation strategies used before and between generative attempts.
 *
 * <p>Every truncated text contains an explicit marker with the words {@code content truncated},
 * so the backend (and a human reading logs) can tell that material was removed.
 */
@Component
@Slf4j
public class ContentTruncator {

  public static final String MARKER = "[...content truncated...]";
  public static final String MOST_MARKER = "[...most content truncated...]";
  public static final String SIGNIFICANT_MARKER = "[...content truncated significantly...]";
  public static final String TOKEN_LIMIT_MARKER = "[...content truncated due to token limits...]";

  private static final int MIN_STRUCTURED_SECTIONS = 6;
  private static final int EDGE_SECTIONS = 5;
  private static final int MIDDLE_SECTIONS = 3;
  private static final int MIDDLE_SECTION_THRESHOLD = 15;
  private static final int SECTION_SNIPPET_CHARS = 600;
  private static final int MIN_COMPACT_CHARS = 1000;

  private static final int HEAD_CHARS = 10_000;
  private static final int MIDDLE_CHARS = 2_000;
  private static final int TAIL_CHARS = 5_000;
  private static final int MIDDLE_SLICE_THRESHOLD = 100_000;

  private static final double HEAD_SHARE = 0.75;

  /**
   * Shrinks a large text for a first generative attempt, preferring its section outline.
   *
   * @param text full document text
   * @param sections sections derived from the text
   * @return compact text, always containing a truncation marker
   */
  public String truncateForGeneration(String text, List<DocumentSection> sections) {
    Optional<String> structured = structuredTruncation(sections);
    if (structured.isPresent()) {
      log.debug("Using structured compact text ({} chars)", structured.get().length());
      return structured.get();
    }
    String positional = positionalTruncation(text);
    log.debug("Truncated text from {} to {} chars", text.length(), positional.length());
    return positional;
  }

  /**
   * Builds a compact text from the first, middle and last sections, each capped in length.
   *
   * @param sections document sections in order
   * @return the compact text, or empty when there are too few sections or the result is too short
   *     to be useful
   */
  public Optional<String> structuredTruncation(List<DocumentSection> sections) {
    int n = sections.size();
    if (n < MIN_STRUCTURED_SECTIONS) {
      return Optional.empty();
    }

    List<List<DocumentSection>> groups = new ArrayList<>();
    groups.add(sections.subList(0, EDGE_SECTIONS));
    int nextUnused = EDGE_SECTIONS;
    if (n > MIDDLE_SECTION_THRESHOLD) {
      int middleStart = Math.max(n / 3, nextUnused);
      int middleEnd = Math.min(middleStart + MIDDLE_SECTIONS, n - EDGE_SECTIONS);
      if (middleStart < middleEnd) {
        groups.add(sections.subList(middleStart, middleEnd));
        nextUnused = middleEnd;
      }
    }
    groups.add(sections.subList(Math.max(n - EDGE_SECTIONS, nextUnused), n));

    StringBuilder compact = new StringBuilder();
    for (int g = 0; g < groups.size(); g++) {
      if (g > 0) {
        compact.append("\n").append(MARKER).append("\n");
      }
      for (DocumentSection section : groups.get(g)) {
        if (!section.title().isEmpty() && !section.content().isEmpty()) {
          compact
              .append("\n## ")
              .append(section.title())
              .append("\n")
              .append(prefix(section.content(), SECTION_SNIPPET_CHARS))
              .append("\n");
        }
      }
    }
    if (compact.length() <= MIN_COMPACT_CHARS) {
      return Optional.empty();
    }
    return Optional.of(compact.toString());
  }

  /**
   * Keeps the beginning and end of a text, plus a slice around the midpoint for moderately large
   * texts.
   *
   * @param text text to shrink
   * @return truncated text
   */
  public String positionalTruncation(String text) {
    String head = prefix(text, HEAD_CHARS);
    String tail = suffix(text, TAIL_CHARS);
    if (text.length() < MIDDLE_SLICE_THRESHOLD) {
      int middleStart = Math.max(0, text.length() / 2 - MIDDLE_CHARS / 2);
      int middleEnd = Math.min(text.length(), middleStart + MIDDLE_CHARS);
      String middle = text.substring(middleStart, middleEnd);
      return join(head, MARKER, middle) + separator(MARKER) + tail;
    }
    return join(head, MOST_MARKER, tail);
  }

  /**
   * Shrinks a text to {@code ratio} of its length for a retry after a transient failure.
   *
   * @param text current text
   * @param ratio fraction of characters to keep
   * @return truncated text, three quarters from the start and one quarter from the end
   */
  public String escalate(String text, double ratio) {
    return keepHeadAndTail(text, (int) (text.length() * ratio), SIGNIFICANT_MARKER);
  }

  /**
   * Keeps a quarter of a text after a context-length rejection.
   *
   * @param text current text
   * @return truncated text
   */
  public String shrinkForContextLimit(String text) {
    return keepHeadAndTail(text, text.length() / 4, TOKEN_LIMIT_MARKER);
  }

  /**
   * Keeps the first {@code headChars} and last {@code tailChars} characters of a text.
   *
   * @param text text to cap
   * @param headChars characters kept from the start
   * @param tailChars characters kept from the end
   * @return capped text with a marker, or the text itself when it is already short enough
   */
  public static String capHeadAndTail(String text, int headChars, int tailChars) {
    if (text.length() <= headChars + tailChars) {
      return text;
    }
    return join(prefix(text, headChars), MARKER, suffix(text, tailChars));
  }

  // ---- private helpers ----

  private String keepHeadAndTail(String text, int keep, String marker) {
    int headSize = (int) (keep * HEAD_SHARE);
    int tailSize = keep - headSize;
    return join(prefix(text, headSize), marker, suffix(text, tailSize));
  }

  private static String join(String head, String marker, String tail) {
    return head + separator(marker) + tail;
  }

  private static String separator(String marker) {
    return "\n\n" + marker + "\n\n";
  }

  private static String prefix(String text, int chars) {
    return text.length() <= chars ? text : text.substring(0, chars);
  }

  private static String suffix(String text, int chars) {
    if (chars <= 0) {
      return "";
    }
    return text.length() <= chars ? text : text.substring(text.length() - chars);
  }
}
