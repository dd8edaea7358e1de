package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.exception.CorruptInputException;
import com.flamingo.ai.casestudy.exception.ResourceExhaustedException;
import com.flamingo.ai.casestudy.service.extraction.ImageNormalizer.NormalizedImage;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.extraction.model.RawExtraction;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceFile;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import javax.xml.namespace.QName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.PaintStyle;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSimpleShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.springframework.stereotype.Service;

/**
 * {@link FormatReader} for PowerPoint presentations, built on Apache POI's XSLF model.
 *
 * <p>Text is emitted slide by slide as {@code Slide N:}, an optional {@code Title:} line and the
 * remaining text shapes. Images are collected from pictures, pictures nested in groups and
 * picture-filled shapes. Shape traversal uses an explicit worklist, so deeply nested groups cannot
 * exhaust the call stack; the global image cap bounds the walk.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PptxDocumentReader implements FormatReader {

  private static final String DRAWING_NS =
      "declare namespace p='http://schemas.openxmlformats.org/presentationml/2006/main' ";

  private final CaseStudyProperties properties;
  private final ImageNormalizer imageNormalizer;

  /** How a shape contributes images. */
  enum ShapeKind {
    PICTURE,
    GROUP,
    FILLED,
    OTHER
  }

  private record PendingShape(XSLFShape shape, String parentTitle) {}

  @Override
  public RawExtraction read(SourceFile source, ReadOptions options) {
    try (InputStream in = Files.newInputStream(source.path());
        XMLSlideShow ppt = new XMLSlideShow(in)) {
      List<XSLFSlide> slides = ppt.getSlides();
      int totalSlides = slides.size();
      log.debug("PPTX {} contains {} slides", source.fileName(), totalSlides);

      String text = extractText(slides);
      if (options.skipImages()) {
        log.info("Skipping image extraction for PPTX {}", source.fileName());
        return RawExtraction.textOnly(text, totalSlides);
      }
      List<ExtractedImage> images = extractImages(slides);
      log.debug("Total images extracted from {}: {}", source.fileName(), images.size());
      return new RawExtraction(text, images, totalSlides, false);
    } catch (IOException | RuntimeException e) {
      log.error("Error processing PPTX {}: {}", source.fileName(), e.getMessage());
      throw new CorruptInputException(
          SourceType.PPTX, "Failed to process PowerPoint presentation: " + e.getMessage(), e);
    } catch (OutOfMemoryError e) {
      throw new ResourceExhaustedException("Out of memory while reading " + source.fileName(), e);
    }
  }

  @Override
  public boolean supports(SourceType type) {
    return type == SourceType.PPTX;
  }

  @Override
  public boolean supportsTextOnlyRecovery() {
    return true;
  }

  /**
   * Chooses the slides whose images are extracted. Above the sampling threshold only the first
   * and last slides plus every stride-th slide in between are used.
   *
   * @param totalSlides number of slides in the deck
   * @return ascending slide indices
   */
  List<Integer> slidesForImages(int totalSlides) {
    CaseStudyProperties.Pptx settings = properties.getPptx();
    List<Integer> all = new ArrayList<>();
    if (totalSlides <= settings.getSamplingThreshold()) {
      for (int i = 0; i < totalSlides; i++) {
        all.add(i);
      }
      return all;
    }
    TreeSet<Integer> sampled = new TreeSet<>();
    for (int i = 0; i < Math.min(settings.getSampleHead(), totalSlides); i++) {
      sampled.add(i);
    }
    for (int i = Math.max(0, totalSlides - settings.getSampleTail()); i < totalSlides; i++) {
      sampled.add(i);
    }
    int middleEnd = totalSlides - settings.getSampleTail();
    for (int i = settings.getSampleHead(); i < middleEnd; i += settings.getSampleStride()) {
      sampled.add(i);
    }
    log.debug(
        "Large presentation: processing {} of {} slides for images", sampled.size(), totalSlides);
    return new ArrayList<>(sampled);
  }

  // ---- private helpers ----

  private String extractText(List<XSLFSlide> slides) {
    int batchSize = Math.max(1, properties.getPptx().getSlideBatchSize());
    StringBuilder text = new StringBuilder();
    for (int start = 0; start < slides.size(); start += batchSize) {
      int end = Math.min(start + batchSize, slides.size());
      log.debug("Processing slide chunk {} to {}", start + 1, end);
      for (int i = start; i < end; i++) {
        appendSlideText(slides.get(i), i, text);
      }
    }
    return text.toString();
  }

  private void appendSlideText(XSLFSlide slide, int index, StringBuilder text) {
    text.append("Slide ").append(index + 1).append(":\n");
    XSLFTextShape titleShape = findTitleShape(slide);
    if (titleShape != null) {
      text.append("Title: ").append(titleShape.getText()).append("\n");
    }
    for (XSLFShape shape : slide.getShapes()) {
      if (shape instanceof XSLFTextShape textShape && textShape != titleShape) {
        String shapeText = textShape.getText();
        if (shapeText != null && !shapeText.isEmpty()) {
          text.append(shapeText).append("\n");
        }
      }
    }
    text.append("\n");
  }

  private XSLFTextShape findTitleShape(XSLFSlide slide) {
    for (XSLFShape shape : slide.getShapes()) {
      if (shape instanceof XSLFTextShape textShape) {
        Placeholder placeholder = textShape.getPlaceholder();
        if (placeholder == Placeholder.TITLE || placeholder == Placeholder.CENTERED_TITLE) {
          return textShape;
        }
      }
    }
    return null;
  }

  private List<ExtractedImage> extractImages(List<XSLFSlide> slides) {
    int maxImages = properties.getPptx().getMaxImages();
    int totalSlides = slides.size();
    List<ExtractedImage> images = new ArrayList<>();

    for (int slideIndex : slidesForImages(totalSlides)) {
      if (images.size() >= maxImages) {
        log.debug("Reached maximum image count ({}). Stopping image extraction", maxImages);
        break;
      }
      XSLFSlide slide = slides.get(slideIndex);
      String title = slide.getTitle();
      String slideTitle =
          title != null && !title.isBlank() ? title : "Slide " + (slideIndex + 1);
      try {
        walkShapes(slide, slideIndex, slideTitle, images);
      } catch (RuntimeException e) {
        log.warn("Error extracting images from slide {}: {}", slideIndex + 1, e.getMessage());
      }

      final int current = slideIndex;
      boolean important = slideIndex < 3 || slideIndex == totalSlides - 1;
      if (important && images.stream().noneMatch(img -> img.sourceIndex() == current)) {
        log.debug("No images found on important slide {}", slideIndex + 1);
      }
    }
    return images;
  }

  private void walkShapes(
      XSLFSlide slide, int slideIndex, String slideTitle, List<ExtractedImage> images) {
    int maxImages = properties.getPptx().getMaxImages();
    Deque<PendingShape> worklist = new ArrayDeque<>();
    pushAll(worklist, slide.getShapes(), null);

    while (!worklist.isEmpty() && images.size() < maxImages) {
      PendingShape pending = worklist.pop();
      String captionTitle = pending.parentTitle() != null ? pending.parentTitle() : slideTitle;
      try {
        switch (classify(pending.shape(), slideIndex)) {
          case PICTURE -> extractPicture(
              (XSLFPictureShape) pending.shape(), slideIndex, captionTitle, images);
          case GROUP -> pushAll(
              worklist, ((XSLFGroupShape) pending.shape()).getShapes(), pending.parentTitle());
          case FILLED -> extractFill(
              (XSLFSimpleShape) pending.shape(), slideIndex, captionTitle, images);
          case OTHER -> {
            // no image content
          }
        }
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Error processing shape '{}' on slide {}: {}",
            pending.shape().getShapeName(),
            slideIndex + 1,
            e.getMessage());
      }
    }
  }

  private void pushAll(Deque<PendingShape> worklist, List<XSLFShape> shapes, String parentTitle) {
    // reverse push keeps document order when popping
    for (int i = shapes.size() - 1; i >= 0; i--) {
      worklist.push(new PendingShape(shapes.get(i), parentTitle));
    }
  }

  private ShapeKind classify(XSLFShape shape, int slideIndex) {
    if (shape instanceof XSLFPictureShape) {
      return ShapeKind.PICTURE;
    }
    if (shape instanceof XSLFGroupShape) {
      return ShapeKind.GROUP;
    }
    if (slideIndex < properties.getPptx().getFillImageSlideLimit()
        && shape instanceof XSLFSimpleShape simple
        && simple.getFillStyle() != null
        && simple.getFillStyle().getPaint() instanceof PaintStyle.TexturePaint) {
      return ShapeKind.FILLED;
    }
    return ShapeKind.OTHER;
  }

  private void extractPicture(
      XSLFPictureShape picture, int slideIndex, String captionTitle, List<ExtractedImage> images) {
    byte[] data = picture.getPictureData().getData();
    Optional<NormalizedImage> normalized = imageNormalizer.normalize(data);
    if (normalized.isEmpty()) {
      return;
    }
    String altText = altText(picture);
    String caption = altText != null ? altText : "Image from " + captionTitle;
    int index = images.size();
    images.add(
        ExtractedImage.of(
            "pptx_image_" + index,
            caption,
            normalized.get().subtype(),
            normalized.get().bytes(),
            slideIndex));
    log.debug("Extracted image {} from slide {}", index + 1, slideIndex + 1);
  }

  private void extractFill(
      XSLFSimpleShape shape, int slideIndex, String captionTitle, List<ExtractedImage> images)
      throws IOException {
    PaintStyle.TexturePaint texture = (PaintStyle.TexturePaint) shape.getFillStyle().getPaint();
    byte[] data;
    try (InputStream in = texture.getImageData()) {
      if (in == null) {
        return;
      }
      data = in.readAllBytes();
    }
    Optional<NormalizedImage> normalized = imageNormalizer.normalize(data);
    if (normalized.isEmpty()) {
      return;
    }
    int index = images.size();
    images.add(
        ExtractedImage.of(
            "pptx_fill_image_" + index,
            "Background image from " + captionTitle,
            normalized.get().subtype(),
            normalized.get().bytes(),
            slideIndex));
    log.debug("Extracted fill image {} from slide {}", index + 1, slideIndex + 1);
  }

  private String altText(XSLFPictureShape picture) {
    XmlObject[] props = picture.getXmlObject().selectPath(DRAWING_NS + "./p:nvPicPr/p:cNvPr");
    if (props.length == 0) {
      return null;
    }
    try (XmlCursor cursor = props[0].newCursor()) {
      String descr = cursor.getAttributeText(new QName("descr"));
      return descr != null && !descr.isBlank() ? descr : null;
    }
  }
}
