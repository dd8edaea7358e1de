package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.exception.CorruptInputException;
import com.flamingo.ai.casestudy.exception.DocumentNotFoundException;
import com.flamingo.ai.casestudy.exception.DocumentProcessingException;
import com.flamingo.ai.casestudy.exception.ErrorCategory;
import com.flamingo.ai.casestudy.exception.ResourceExhaustedException;
import com.flamingo.ai.casestudy.exception.UnsupportedFormatException;
import com.flamingo.ai.casestudy.service.extraction.model.DocumentMetadata;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.extraction.model.ProcessingStatus;
import com.flamingo.ai.casestudy.service.extraction.model.RawExtraction;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceFile;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import com.flamingo.ai.casestudy.service.generation.ContentTruncator;
import com.flamingo.ai.casestudy.service.generation.SizeGovernor;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a file path or URL into an {@link ExtractedDocument}.
 *
 * <p>Pipeline per file:
 *
 * <ol>
 *   <li>Resolve the format from the URL scheme or file extension.
 *   <li>Apply the size policy from {@link SizeGovernor}.
 *   <li>Read with the routed {@link FormatReader}; on failure retry once in text-only mode where
 *       the reader supports it.
 *   <li>Cap very long text, derive structured content and metadata.
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessor {

  private final FormatReaderRouter readerRouter;
  private final WebPageReader webPageReader;
  private final StructureExtractor structureExtractor;
  private final SizeGovernor sizeGovernor;
  private final CaseStudyProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Reads one document.
   *
   * @param pathOrUrl local file path or http(s) URL
   * @return extracted document; web pages report download failures through their status
   * @throws DocumentProcessingException if a local file cannot be read
   */
  public ExtractedDocument process(String pathOrUrl) {
    log.debug("Processing document: {}", pathOrUrl);
    if (isUrl(pathOrUrl)) {
      return webPageReader.read(pathOrUrl);
    }
    SourceFile source = resolve(pathOrUrl);
    sizeGovernor.checkFileSize(source.fileName(), source.sizeBytes());
    return readFile(source);
  }

  /**
   * Reads a primary document and merges supplementary documents into it.
   *
   * <p>The primary document's failures propagate. A supplementary document that fails is logged
   * and left out.
   *
   * @param primary path or URL of the main document
   * @param supplementary paths or URLs of additional documents
   * @return merged document
   */
  public ExtractedDocument processAll(String primary, List<String> supplementary) {
    long total = sizeOf(primary);
    for (String extra : supplementary) {
      total += sizeOf(extra);
    }
    sizeGovernor.checkAggregateSize(total);

    ExtractedDocument main = process(primary);
    if (supplementary.isEmpty()) {
      return main;
    }

    StringBuilder text = new StringBuilder(main.text());
    List<ExtractedImage> images = new ArrayList<>(main.images());
    boolean skipGenerative = main.skipGenerativeProcessing();
    int merged = 0;

    for (int i = 0; i < supplementary.size(); i++) {
      String extra = supplementary.get(i);
      ExtractedDocument doc;
      try {
        doc = process(extra);
      } catch (DocumentProcessingException e) {
        log.warn("Skipping supplementary document {}: {}", extra, e.getMessage());
        continue;
      }
      if (!doc.metadata().isSuccess()) {
        log.warn("Skipping supplementary document {}: {}", extra, doc.metadata().errorDetail());
        continue;
      }
      text.append("\n\n--- Document ")
          .append(i + 2)
          .append(": ")
          .append(doc.metadata().sourceName())
          .append(" ---\n\n")
          .append(doc.text());
      String prefix = "supp_" + (i + 1) + "_";
      for (ExtractedImage image : doc.images()) {
        images.add(image.withId(prefix + image.id()));
      }
      skipGenerative |= doc.skipGenerativeProcessing();
      merged++;
    }

    log.info("Merged {} of {} supplementary documents", merged, supplementary.size());
    String mergedText = text.toString();
    DocumentMetadata metadata =
        main.metadata().toBuilder()
            .sizeBytes(total)
            .skipGenerativeProcessing(skipGenerative)
            .wordCount(StructureExtractor.countWords(mergedText))
            .build();
    return new ExtractedDocument(
        mergedText,
        images,
        structureExtractor.extract(mergedText, main.sourceType()),
        metadata);
  }

  // ---- private helpers ----

  private ExtractedDocument readFile(SourceFile source) {
    SizeGovernor.ReadPolicy policy = sizeGovernor.readPolicy(source.type(), source.sizeBytes());
    if (policy.options().skipImages()) {
      meterRegistry
          .counter("casestudy.extraction.images.skipped", "type", source.type().name())
          .increment();
    }

    FormatReader reader = readerRouter.route(source.type());
    RawExtraction raw;
    String errorDetail = null;
    boolean skipGenerative = policy.skipGenerativeProcessing();
    try {
      raw = reader.read(source, policy.options());
    } catch (DocumentProcessingException e) {
      if (!reader.supportsTextOnlyRecovery()) {
        throw e;
      }
      raw = recoverTextOnly(reader, source, e);
      errorDetail = "Recovered with text-only extraction after: " + e.getMessage();
      skipGenerative = true;
    }
    if (raw.recoveredTextOnly()) {
      skipGenerative = true;
      if (errorDetail == null) {
        errorDetail = "Recovered with text-only extraction";
      }
    }

    String text = raw.text();
    if (sizeGovernor.exceedsIngestCap(source.sizeBytes(), text.length())) {
      CaseStudyProperties.Limits limits = properties.getLimits();
      text =
          ContentTruncator.capHeadAndTail(
              text, limits.getIngestHeadChars(), limits.getIngestTailChars());
      log.info(
          "Capped text of {} from {} to {} chars",
          source.fileName(),
          raw.text().length(),
          text.length());
    }

    DocumentMetadata metadata =
        DocumentMetadata.builder()
            .sourceType(source.type())
            .sourceName(source.fileName())
            .sizeBytes(source.sizeBytes())
            .status(ProcessingStatus.SUCCESS)
            .errorDetail(errorDetail)
            .skipGenerativeProcessing(skipGenerative)
            .recoveredTextOnly(raw.recoveredTextOnly())
            .wordCount(StructureExtractor.countWords(text))
            .pageCount(raw.pageCount())
            .processedAt(Instant.now())
            .build();
    return new ExtractedDocument(
        text, raw.images(), structureExtractor.extract(text, source.type()), metadata);
  }

  private RawExtraction recoverTextOnly(
      FormatReader reader, SourceFile source, DocumentProcessingException original) {
    log.info("Attempting recovery with text-only extraction for {}", source.fileName());
    RawExtraction recovered;
    try {
      recovered = reader.read(source, ReadOptions.TEXT_ONLY);
    } catch (DocumentProcessingException e) {
      log.error("Recovery failed for {}: {}", source.fileName(), e.getMessage());
      if (original instanceof ResourceExhaustedException) {
        original.addSuppressed(e);
        throw original;
      }
      CorruptInputException failure =
          new CorruptInputException(
              source.type(),
              "Failed to process " + source.fileName() + ": " + original.getMessage(),
              original);
      failure.addSuppressed(e);
      throw failure;
    }
    if (recovered.text().isBlank()) {
      log.error("Recovery failed for {}: no text extracted", source.fileName());
      if (original instanceof ResourceExhaustedException) {
        throw original;
      }
      throw new CorruptInputException(
          source.type(), "Recovery failed: no text in " + source.fileName(), original);
    }
    log.info("Recovery successful with text-only extraction for {}", source.fileName());
    return recovered.asRecovered();
  }

  private SourceFile resolve(String pathString) {
    Path path = Path.of(pathString);
    if (!Files.isRegularFile(path)) {
      throw new DocumentNotFoundException(pathString);
    }
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String extension = dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    SourceType type =
        SourceType.fromExtension(extension)
            .orElseThrow(() -> new UnsupportedFormatException(extension));
    try {
      return new SourceFile(path, fileName, type, Files.size(path));
    } catch (IOException e) {
      throw new DocumentProcessingException(
          ErrorCategory.CORRUPT_INPUT,
          "Could not stat " + pathString,
          "The uploaded file could not be read.",
          e);
    }
  }

  private long sizeOf(String pathOrUrl) {
    if (isUrl(pathOrUrl)) {
      return 0;
    }
    try {
      Path path = Path.of(pathOrUrl);
      return Files.isRegularFile(path) ? Files.size(path) : 0;
    } catch (IOException e) {
      log.debug("Could not stat {}: {}", pathOrUrl, e.getMessage());
      return 0;
    }
  }

  private static boolean isUrl(String pathOrUrl) {
    String lower = pathOrUrl.toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }
}
