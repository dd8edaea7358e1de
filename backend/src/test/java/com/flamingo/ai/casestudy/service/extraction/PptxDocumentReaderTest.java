package com.flamingo.ai.casestudy.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.exception.CorruptInputException;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.extraction.model.RawExtraction;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceFile;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.awt.Rectangle;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.sl.usermodel.PictureData;
import org.apache.poi.sl.usermodel.PictureData.PictureType;
import org.apache.poi.xslf.usermodel.SlideLayout;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFRelation;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openxmlformats.schemas.drawingml.x2006.main.CTBlipFillProperties;
import org.openxmlformats.schemas.presentationml.x2006.main.CTShape;

@DisplayName("PptxDocumentReader Tests")
class PptxDocumentReaderTest {

  @TempDir Path tempDir;

  private CaseStudyProperties properties;
  private PptxDocumentReader reader;

  @BeforeEach
  void setUp() {
    properties = new CaseStudyProperties();
    reader = new PptxDocumentReader(properties, new ImageNormalizer(properties));
  }

  private SourceFile source(Path path) throws IOException {
    return new SourceFile(path, path.getFileName().toString(), SourceType.PPTX, Files.size(path));
  }

  private Path createDeck(String name, List<String> titles, boolean withPicture)
      throws IOException {
    Path path = tempDir.resolve(name);
    try (XMLSlideShow ppt = new XMLSlideShow()) {
      XSLFSlideLayout layout =
          ppt.getSlideMasters().get(0).getLayout(SlideLayout.TITLE_AND_CONTENT);
      XSLFPictureData picture =
          withPicture ? ppt.addPicture(TestImages.png(120, 80), PictureData.PictureType.PNG) : null;
      for (String title : titles) {
        XSLFSlide slide = ppt.createSlide(layout);
        XSLFTextShape titleShape = slide.getPlaceholder(0);
        titleShape.setText(title);
        XSLFTextShape body = slide.getPlaceholder(1);
        body.setText("Notes for " + title);
        if (picture != null) {
          XSLFPictureShape shape = slide.createPicture(picture);
          shape.setAnchor(new Rectangle(50, 50, 120, 80));
        }
      }
      try (OutputStream out = Files.newOutputStream(path)) {
        ppt.write(out);
      }
    }
    return path;
  }

  private Path save(XMLSlideShow ppt, String name) throws IOException {
    Path path = tempDir.resolve(name);
    try (OutputStream out = Files.newOutputStream(path)) {
      ppt.write(out);
    }
    return path;
  }

  @Test
  @DisplayName("should label slide text with slide numbers and titles")
  void shouldExtractSlideText_whenDeckValid() throws Exception {
    Path deck = createDeck("deck.pptx", List.of("Project Phoenix", "Results"), false);

    RawExtraction raw = reader.read(source(deck), ReadOptions.FULL);

    assertThat(raw.text())
        .startsWith("Slide 1:\nTitle: Project Phoenix\n")
        .contains("Notes for Project Phoenix\n")
        .contains("Slide 2:\nTitle: Results\n");
    assertThat(raw.pageCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("should caption pictures with the slide title and record the slide index")
  void shouldExtractPictures_whenSlidesHavePictures() throws Exception {
    Path deck = createDeck("pictures.pptx", List.of("Architecture", "Rollout"), true);

    RawExtraction raw = reader.read(source(deck), ReadOptions.FULL);

    assertThat(raw.images())
        .extracting(ExtractedImage::id)
        .containsExactly("pptx_image_0", "pptx_image_1");
    assertThat(raw.images())
        .extracting(ExtractedImage::caption)
        .containsExactly("Image from Architecture", "Image from Rollout");
    assertThat(raw.images()).extracting(ExtractedImage::sourceIndex).containsExactly(0, 1);
  }

  @Test
  @DisplayName("should extract pictures nested inside group shapes")
  void shouldExtractPictures_whenNestedInGroups() throws Exception {
    Path deck;
    try (XMLSlideShow ppt = new XMLSlideShow()) {
      XSLFPictureData picture = ppt.addPicture(TestImages.png(120, 80), PictureType.PNG);
      XSLFSlide slide = ppt.createSlide();
      XSLFGroupShape outer = slide.createGroup();
      outer.createPicture(picture).setAnchor(new Rectangle(10, 10, 120, 80));
      XSLFGroupShape inner = outer.createGroup();
      inner.createPicture(picture).setAnchor(new Rectangle(200, 10, 120, 80));
      deck = save(ppt, "groups.pptx");
    }

    RawExtraction raw = reader.read(source(deck), ReadOptions.FULL);

    assertThat(raw.images()).hasSize(2);
    assertThat(raw.images())
        .extracting(ExtractedImage::caption)
        .containsOnly("Image from Slide 1");
    assertThat(raw.images()).extracting(ExtractedImage::sourceIndex).containsOnly(0);
  }

  @Test
  @DisplayName("should extract picture fills as background images")
  void shouldExtractFillImages_whenShapeHasPictureFill() throws Exception {
    Path deck;
    try (XMLSlideShow ppt = new XMLSlideShow()) {
      XSLFPictureData picture = ppt.addPicture(TestImages.png(160, 90), PictureType.PNG);
      ppt.createSlide();
      XSLFSlide slide = ppt.createSlide();
      XSLFAutoShape shape = slide.createAutoShape();
      shape.setAnchor(new Rectangle(0, 0, 160, 90));
      String relId =
          slide.addRelation(null, XSLFRelation.IMAGES, picture).getRelationship().getId();
      CTBlipFillProperties fill = ((CTShape) shape.getXmlObject()).getSpPr().addNewBlipFill();
      fill.addNewBlip().setEmbed(relId);
      fill.addNewStretch().addNewFillRect();
      deck = save(ppt, "fill.pptx");
    }

    RawExtraction raw = reader.read(source(deck), ReadOptions.FULL);

    assertThat(raw.images()).hasSize(1);
    ExtractedImage image = raw.images().get(0);
    assertThat(image.id()).isEqualTo("pptx_fill_image_0");
    assertThat(image.caption()).isEqualTo("Background image from Slide 2");
    assertThat(image.sourceIndex()).isEqualTo(1);
  }

  @Test
  @DisplayName("should skip decorative images below the minimum size")
  void shouldSkipSmallPictures_whenBelowMinimumSize() throws Exception {
    Path deck;
    try (XMLSlideShow ppt = new XMLSlideShow()) {
      XSLFSlide slide = ppt.createSlide();
      slide
          .createPicture(ppt.addPicture(TestImages.png(30, 30), PictureType.PNG))
          .setAnchor(new Rectangle(0, 0, 30, 30));
      slide
          .createPicture(ppt.addPicture(TestImages.png(120, 80), PictureType.PNG))
          .setAnchor(new Rectangle(50, 50, 120, 80));
      deck = save(ppt, "icons.pptx");
    }

    RawExtraction raw = reader.read(source(deck), ReadOptions.FULL);

    assertThat(raw.images()).extracting(ExtractedImage::id).containsExactly("pptx_image_0");
  }

  @Test
  @DisplayName("should stop collecting images at the configured maximum")
  void shouldCapImages_whenMaximumReached() throws Exception {
    properties.getPptx().setMaxImages(2);
    Path deck = createDeck("capped.pptx", List.of("One", "Two", "Three"), true);

    RawExtraction raw = reader.read(source(deck), ReadOptions.FULL);

    assertThat(raw.images()).hasSize(2);
    assertThat(raw.images()).extracting(ExtractedImage::sourceIndex).containsExactly(0, 1);
    assertThat(raw.text()).contains("Title: Three");
  }

  @Test
  @DisplayName("should skip pictures in text-only mode")
  void shouldSkipPictures_whenTextOnly() throws Exception {
    Path deck = createDeck("text.pptx", List.of("Architecture"), true);

    RawExtraction raw = reader.read(source(deck), ReadOptions.TEXT_ONLY);

    assertThat(raw.images()).isEmpty();
    assertThat(raw.text()).contains("Title: Architecture");
  }

  @Test
  @DisplayName("should return empty content for a deck without slides")
  void shouldReturnEmpty_whenDeckHasNoSlides() throws Exception {
    Path deck = createDeck("empty.pptx", List.of(), false);

    RawExtraction raw = reader.read(source(deck), ReadOptions.FULL);

    assertThat(raw.text()).isEmpty();
    assertThat(raw.images()).isEmpty();
    assertThat(raw.pageCount()).isZero();
  }

  @Test
  @DisplayName("should sample head, tail and every fifth slide of large decks")
  void shouldSampleSlides_whenDeckIsLarge() {
    List<Integer> sampled = reader.slidesForImages(100);

    assertThat(sampled).hasSize(36).startsWith(0, 1, 2).endsWith(98, 99);
    assertThat(sampled).contains(10, 15, 85).doesNotContain(11, 86, 89);
    assertThat(reader.slidesForImages(50)).hasSize(50);
  }

  @Test
  @DisplayName("should raise a corrupt-input error for a broken file")
  void shouldThrowCorrupt_whenFileBroken() throws Exception {
    Path broken = Files.writeString(tempDir.resolve("broken.pptx"), "garbage");

    assertThatThrownBy(() -> reader.read(source(broken), ReadOptions.FULL))
        .isInstanceOf(CorruptInputException.class);
  }
}
