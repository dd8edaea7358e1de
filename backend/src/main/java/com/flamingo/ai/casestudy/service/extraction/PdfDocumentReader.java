package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.exception.CorruptInputException;
import com.flamingo.ai.casestudy.exception.ResourceExhaustedException;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.extraction.model.RawExtraction;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceFile;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * {@link FormatReader} for PDF documents, built on Apache PDFBox 3.x.
 *
 * <ul>
 *   <li><strong>Text</strong> is extracted page by page; a page that fails is skipped.
 *   <li><strong>Images</strong> drawn on each page are captured through a {@link PDFStreamEngine}
 *       that intercepts the {@code Do} operator. JPEG streams keep their original bytes.
 *   <li><strong>Page renders</strong> replace embedded images when none were found. Rendering runs
 *       on the render executor under a timeout and is retried once at a lower DPI.
 * </ul>
 */
@Service
@Slf4j
public class PdfDocumentReader implements FormatReader {

  private static final int MAX_IMAGE_BYTES = 10 * 1024 * 1024;

  private final CaseStudyProperties properties;
  private final ImageNormalizer imageNormalizer;
  private final AsyncTaskExecutor renderExecutor;

  public PdfDocumentReader(
      CaseStudyProperties properties,
      ImageNormalizer imageNormalizer,
      @Qualifier("renderExecutor") AsyncTaskExecutor renderExecutor) {
    this.properties = properties;
    this.imageNormalizer = imageNormalizer;
    this.renderExecutor = renderExecutor;
  }

  @Override
  public RawExtraction read(SourceFile source, ReadOptions options) {
    try (PDDocument pdfDoc = Loader.loadPDF(source.path().toFile())) {
      int pageCount = pdfDoc.getNumberOfPages();
      String text = extractText(pdfDoc);
      if (options.skipImages()) {
        log.info("Skipping image extraction for PDF {}", source.fileName());
        return RawExtraction.textOnly(text, pageCount);
      }

      List<ExtractedImage> images = extractEmbeddedImages(pdfDoc);
      if (images.isEmpty()) {
        images = renderPages(pdfDoc, source.fileName());
      }
      log.debug(
          "PDF {} read: {} pages, {} chars, {} images",
          source.fileName(),
          pageCount,
          text.length(),
          images.size());
      return new RawExtraction(text, images, pageCount, false);
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", source.fileName(), e.getMessage());
      throw new CorruptInputException(
          SourceType.PDF, "Failed to parse PDF: " + e.getMessage(), e);
    } catch (OutOfMemoryError e) {
      throw new ResourceExhaustedException("Out of memory while reading " + source.fileName(), e);
    }
  }

  @Override
  public boolean supports(SourceType type) {
    return type == SourceType.PDF;
  }

  @Override
  public boolean supportsTextOnlyRecovery() {
    return true;
  }

  // ---- private helpers ----

  private String extractText(PDDocument pdfDoc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    StringBuilder text = new StringBuilder();
    int pageCount = pdfDoc.getNumberOfPages();
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      try {
        text.append(stripper.getText(pdfDoc)).append("\n");
      } catch (IOException | RuntimeException e) {
        log.warn("Could not extract text from page {}: {}", page, e.getMessage());
      }
    }
    return text.toString();
  }

  private List<ExtractedImage> extractEmbeddedImages(PDDocument pdfDoc) {
    EmbeddedImageExtractor extractor = new EmbeddedImageExtractor();
    int pageNumber = 0;
    for (PDPage page : pdfDoc.getPages()) {
      try {
        extractor.setCurrentPage(pageNumber);
        extractor.processPage(page);
      } catch (IOException | RuntimeException e) {
        log.warn("Could not process page {} for image extraction: {}", pageNumber, e.getMessage());
      }
      pageNumber++;
    }
    log.debug("Embedded image extraction complete. Found {} images", extractor.images.size());
    return extractor.images;
  }

  private List<ExtractedImage> renderPages(PDDocument pdfDoc, String fileName) {
    CaseStudyProperties.Pdf settings = properties.getPdf();
    try {
      return renderWithTimeout(pdfDoc, settings.getRenderDpi());
    } catch (IOException | RuntimeException | TimeoutException e) {
      log.error(
          "Error rendering {} at {} DPI, retrying at {} DPI: {}",
          fileName,
          settings.getRenderDpi(),
          settings.getFallbackRenderDpi(),
          e.toString());
    }
    try {
      return renderWithTimeout(pdfDoc, settings.getFallbackRenderDpi());
    } catch (IOException | RuntimeException | TimeoutException e) {
      log.error(
          "Page rendering failed for {}, continuing without images: {}", fileName, e.toString());
      return List.of();
    }
  }

  private List<ExtractedImage> renderWithTimeout(PDDocument pdfDoc, float dpi)
      throws IOException, TimeoutException {
    Future<List<ExtractedImage>> future = renderExecutor.submit(() -> renderAll(pdfDoc, dpi));
    try {
      return future.get(properties.getPdf().getRenderTimeoutSeconds(), TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw e;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while rendering pages", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      throw new IOException("Page rendering failed", cause);
    }
  }

  private List<ExtractedImage> renderAll(PDDocument pdfDoc, float dpi) throws IOException {
    PDFRenderer renderer = new PDFRenderer(pdfDoc);
    float quality = properties.getPdf().getJpegQuality();
    List<ExtractedImage> pages = new ArrayList<>();
    for (int i = 0; i < pdfDoc.getNumberOfPages(); i++) {
      if (Thread.currentThread().isInterrupted()) {
        throw new IOException("Rendering cancelled after " + i + " pages");
      }
      try {
        BufferedImage pageImage = renderer.renderImageWithDPI(i, dpi);
        byte[] jpeg = imageNormalizer.toJpeg(pageImage, quality);
        pages.add(ExtractedImage.of("pdf_page_" + i, "Page " + (i + 1), "jpeg", jpeg, i));
        log.debug("Rendered page {} ({} KB)", i + 1, jpeg.length / 1024);
      } catch (IOException | RuntimeException e) {
        log.error("Error rendering page {}: {}", i + 1, e.getMessage());
      }
    }
    return pages;
  }

  private ExtractedImage convertImage(PDImageXObject imageXObject, int index, int pageNumber) {
    try {
      String suffix = imageXObject.getSuffix();
      byte[] data;
      String subtype;
      if ("jpg".equalsIgnoreCase(suffix) || "jpeg".equalsIgnoreCase(suffix)) {
        try (InputStream in =
            imageXObject.getStream().createInputStream(List.of(COSName.DCT_DECODE.getName()))) {
          data = in.readAllBytes();
        }
        subtype = "jpeg";
      } else {
        BufferedImage bufferedImage = imageXObject.getImage();
        if (bufferedImage == null) {
          return null;
        }
        data = imageNormalizer.toPng(bufferedImage);
        subtype = "png";
      }

      if (data.length > MAX_IMAGE_BYTES) {
        log.warn("Skipping oversized image {} ({} bytes)", index, data.length);
        return null;
      }
      return ExtractedImage.of(
          "pdf_embedded_" + index,
          String.format(Locale.ROOT, "Embedded image %d (Page %d)", index + 1, pageNumber + 1),
          subtype,
          data,
          pageNumber);
    } catch (IOException | RuntimeException e) {
      log.warn("Could not extract image {} from PDF: {}", index, e.getMessage());
      return null;
    }
  }

  // ---- inner types ----

  /** Collects images drawn by {@code Do} operators, descending into form XObjects. */
  private final class EmbeddedImageExtractor extends PDFStreamEngine {

    private final List<ExtractedImage> images = new ArrayList<>();
    private final Set<COSBase> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private int currentPageNumber = 0;

    EmbeddedImageExtractor() {
      addOperator(new DrawObject(this));
    }

    void setCurrentPage(int pageNumber) {
      this.currentPageNumber = pageNumber;
    }

    void accept(PDImageXObject imageXObject) {
      if (!seen.add(imageXObject.getCOSObject())) {
        return;
      }
      ExtractedImage img = convertImage(imageXObject, images.size(), currentPageNumber);
      if (img != null) {
        images.add(img);
        log.debug("Extracted embedded image {} from page {}", images.size(), currentPageNumber + 1);
      }
    }
  }

  /** Operator processor for the "Do" command. */
  private static final class DrawObject extends OperatorProcessor {

    private final EmbeddedImageExtractor extractor;

    DrawObject(EmbeddedImageExtractor extractor) {
      super(extractor);
      this.extractor = extractor;
    }

    @Override
    public void process(Operator operator, List<COSBase> operands) throws IOException {
      if (operands.isEmpty() || !(operands.get(0) instanceof COSName objectName)) {
        return;
      }
      PDXObject xObject = extractor.getResources().getXObject(objectName);
      if (xObject instanceof PDImageXObject imageXObject) {
        extractor.accept(imageXObject);
      } else if (xObject instanceof PDFormXObject form) {
        extractor.showForm(form);
      }
    }

    @Override
    public String getName() {
      return OperatorName.DRAW_OBJECT;
    }
  }
}
