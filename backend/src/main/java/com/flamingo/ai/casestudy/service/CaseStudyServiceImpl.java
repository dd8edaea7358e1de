package com.flamingo.ai.casestudy.service;

import com.flamingo.ai.casestudy.agent.TextEditorAgent;
import com.flamingo.ai.casestudy.service.extraction.DocumentProcessor;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.generation.ImageSelector;
import com.flamingo.ai.casestudy.service.generation.NarrativeGenerator;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudy;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudyDraft;
import com.flamingo.ai.casestudy.service.generation.model.ImprovementMode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Default {@link CaseStudyService} wiring extraction, generation and text editing together. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CaseStudyServiceImpl implements CaseStudyService {

  private final DocumentProcessor documentProcessor;
  private final NarrativeGenerator narrativeGenerator;
  private final ImageSelector imageSelector;
  private final Optional<TextEditorAgent> textEditorAgent;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "casestudy.document.process", description = "Time to extract a document")
  public ExtractedDocument processDocument(String pathOrUrl) {
    log.info("Processing document: {}", pathOrUrl);
    ExtractedDocument document = documentProcessor.process(pathOrUrl);
    log.info(
        "Processed {}: {} words, {} images, status {}",
        document.metadata().sourceName(),
        document.metadata().wordCount(),
        document.images().size(),
        document.metadata().status());
    return document;
  }

  @Override
  @Timed(value = "casestudy.document.process", description = "Time to extract a document")
  public ExtractedDocument processDocuments(String primary, List<String> supplementary) {
    log.info("Processing {} with {} supplementary documents", primary, supplementary.size());
    return documentProcessor.processAll(primary, supplementary);
  }

  @Override
  @Timed(value = "casestudy.generation", description = "Time to write a case study")
  public CaseStudy generateCaseStudy(ExtractedDocument document, String audience) {
    CaseStudy caseStudy = narrativeGenerator.generate(document, audience);
    log.info(
        "Generated case study '{}' ({}, {} images)",
        caseStudy.title(),
        caseStudy.generationMode(),
        caseStudy.images().size());
    return caseStudy;
  }

  @Override
  @CircuitBreaker(name = "openai", fallbackMethod = "improveTextFallback")
  public String improveText(String text, ImprovementMode mode) {
    if (text == null || text.isBlank()) {
      return text;
    }
    if (textEditorAgent.isEmpty()) {
      log.debug("No text editor configured, returning text unchanged");
      return text;
    }
    TextEditorAgent agent = textEditorAgent.get();
    ImprovementMode effective = mode != null ? mode : ImprovementMode.IMPROVE;
    String result =
        switch (effective) {
          case SIMPLIFY -> agent.simplify(text);
          case EXTEND -> agent.extend(text);
          case IMPROVE -> agent.improve(text);
        };
    if (result == null || result.isBlank()) {
      log.warn("Text editor returned an empty result for mode {}", effective);
      return text;
    }
    meterRegistry.counter("casestudy.text.improve.success", "mode", effective.name()).increment();
    return result.strip();
  }

  @Override
  public List<ExtractedImage> selectKeyImages(
      List<ExtractedImage> images, CaseStudyDraft draft, int maxImages) {
    return imageSelector.select(images, draft.narrativeText(), maxImages);
  }

  // ---- fallback methods ----

  @SuppressWarnings("unused")
  private String improveTextFallback(String text, ImprovementMode mode, Throwable t) {
    log.warn("Text improvement ({}) failed, returning original text: {}", mode, t.getMessage());
    meterRegistry.counter("casestudy.text.improve.fallback").increment();
    return text;
  }
}
