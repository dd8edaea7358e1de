package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.service.extraction.model.DocumentMetadata;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ProcessingStatus;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import com.flamingo.ai.casestudy.service.extraction.model.StructuredContent;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Fetches a web page and keeps its main textual content.
 *
 * <p>Never throws: a failed download or parse yields an empty document with status {@link
 * ProcessingStatus#ERROR}. Images are never extracted from web pages.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebPageReader {

  private static final String BOILERPLATE =
      "script, style, noscript, nav, header, footer, aside, form, iframe, svg, button";

  private static final String TEXT_BLOCKS =
      "h1, h2, h3, h4, h5, h6, p, li, blockquote, pre, td, th, figcaption";

  private static final List<String> MAIN_CONTENT = List.of("article", "main", "[role=main]");

  private static final List<String> PUBLISHED_DATE =
      List.of(
          "meta[property=article:published_time]",
          "meta[name=date]",
          "meta[name=pubdate]",
          "meta[itemprop=datePublished]");

  private final CaseStudyProperties properties;
  private final StructureExtractor structureExtractor;

  /**
   * Downloads and extracts a page.
   *
   * @param url http or https URL
   * @return extracted document; check {@link DocumentMetadata#isSuccess()}
   */
  public ExtractedDocument read(String url) {
    log.debug("Processing web content from URL: {}", url);
    try {
      Document page =
          Jsoup.connect(url)
              .userAgent(properties.getWeb().getUserAgent())
              .timeout(properties.getWeb().getTimeoutMillis())
              .followRedirects(true)
              .get();
      return extract(page, url);
    } catch (IOException | RuntimeException e) {
      log.error("Error processing web content from {}: {}", url, e.getMessage());
      return failed(url, e.getMessage());
    }
  }

  /**
   * Extracts main content and metadata from an already parsed page.
   *
   * @param page parsed HTML document
   * @param url address the page was loaded from
   * @return extracted document
   */
  ExtractedDocument extract(Document page, String url) {
    String title = firstNonBlank(meta(page, "meta[property=og:title]"), page.title());
    String publishedDate = publishedDate(page);
    String text = mainText(page);

    StructuredContent structured = structureExtractor.extract(text, SourceType.WEB);
    if (structured.title() == null && title != null) {
      structured = structured.withTitle(title);
    }

    DocumentMetadata metadata =
        DocumentMetadata.builder()
            .sourceType(SourceType.WEB)
            .sourceName(url)
            .status(ProcessingStatus.SUCCESS)
            .wordCount(StructureExtractor.countWords(text))
            .processedAt(Instant.now())
            .domain(domain(url))
            .pageTitle(title)
            .publishedDate(publishedDate)
            .build();
    log.debug("Extracted {} chars from {}", text.length(), url);
    return new ExtractedDocument(text, List.of(), structured, metadata);
  }

  // ---- private helpers ----

  private String mainText(Document page) {
    Element body = page.body();
    if (body == null) {
      return "";
    }
    body.select(BOILERPLATE).remove();

    Element root = body;
    for (String selector : MAIN_CONTENT) {
      Element candidate = body.selectFirst(selector);
      if (candidate != null) {
        root = candidate;
        break;
      }
    }

    Set<Element> emitted = Collections.newSetFromMap(new IdentityHashMap<>());
    StringBuilder text = new StringBuilder();
    for (Element block : root.select(TEXT_BLOCKS)) {
      if (block.parents().stream().anyMatch(emitted::contains)) {
        continue;
      }
      String blockText = block.text().strip();
      if (!blockText.isEmpty()) {
        text.append(blockText).append("\n");
        emitted.add(block);
      }
    }
    if (text.length() == 0) {
      return root.text();
    }
    return text.toString();
  }

  private String publishedDate(Document page) {
    for (String selector : PUBLISHED_DATE) {
      String value = meta(page, selector);
      if (value != null) {
        return value;
      }
    }
    Element time = page.selectFirst("time[datetime]");
    return time != null ? time.attr("datetime") : null;
  }

  private String meta(Document page, String selector) {
    Element element = page.selectFirst(selector);
    if (element == null) {
      return null;
    }
    String content = element.attr("content");
    return content.isBlank() ? null : content.strip();
  }

  private String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    return second != null && !second.isBlank() ? second.strip() : null;
  }

  private String domain(String url) {
    try {
      return URI.create(url).getHost();
    } catch (IllegalArgumentException e) {
      log.debug("Could not parse host of {}", url);
      return null;
    }
  }

  private ExtractedDocument failed(String url, String detail) {
    DocumentMetadata metadata =
        DocumentMetadata.builder()
            .sourceType(SourceType.WEB)
            .sourceName(url)
            .status(ProcessingStatus.ERROR)
            .errorDetail(detail != null ? detail : "Failed to download content")
            .processedAt(Instant.now())
            .domain(domain(url))
            .build();
    return new ExtractedDocument("", List.of(), StructuredContent.empty(), metadata);
  }
}
