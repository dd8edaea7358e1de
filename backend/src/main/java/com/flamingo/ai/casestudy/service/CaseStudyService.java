package com.flamingo.ai.casestudy.service;

import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudy;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudyDraft;
import com.flamingo.ai.casestudy.service.generation.model.ImprovementMode;
import java.util.List;

/** Entry point for turning documents into case studies. */
public interface CaseStudyService {

  /**
   * Extracts text, images and structure from a local file or a web page.
   *
   * @param pathOrUrl file path or http(s) URL
   * @return the extracted document
   * @throws com.flamingo.ai.casestudy.exception.DocumentProcessingException if a local file cannot
   *     be read even after text-only recovery
   */
  ExtractedDocument processDocument(String pathOrUrl);

  /**
   * Extracts a primary document and merges supplementary documents into it.
   *
   * @param primary path or URL of the main document
   * @param supplementary additional documents; failures here are logged and skipped
   * @return the merged document
   */
  ExtractedDocument processDocuments(String primary, List<String> supplementary);

  /**
   * Writes a case study for the general audience.
   *
   * @param document extracted document
   * @return the case study, never null
   */
  default CaseStudy generateCaseStudy(ExtractedDocument document) {
    return generateCaseStudy(document, "general");
  }

  /**
   * Writes a case study. Backend failures degrade to the heuristic generator.
   *
   * @param document extracted document
   * @param audience target audience
   * @return the case study, never null
   */
  CaseStudy generateCaseStudy(ExtractedDocument document, String audience);

  /**
   * Rewrites a passage of text. Returns the input unchanged when no backend is available.
   *
   * @param text passage to rewrite
   * @param mode improve, simplify or extend
   * @return the rewritten or original text
   */
  String improveText(String text, ImprovementMode mode);

  List<ExtractedImage> selectKeyImages(
      List<ExtractedImage> images, CaseStudyDraft draft, int maxImages);
}
