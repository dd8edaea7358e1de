package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.exception.CorruptInputException;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.extraction.model.RawExtraction;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceFile;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFPictureData;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Service;

/**
 * {@link FormatReader} for Word documents.
 *
 * <p>DOCX files are read with Apache POI: paragraph and table-cell text in body order, plus every
 * picture part that decodes as an image. Legacy {@code .doc} files, and DOCX containers POI
 * rejects, go through a text-only Tika pass instead.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocxDocumentReader implements FormatReader {

  private final ImageNormalizer imageNormalizer;
  private final TikaTextExtractor tikaTextExtractor;

  @Override
  public RawExtraction read(SourceFile source, ReadOptions options) {
    if (source.fileName().toLowerCase(Locale.ROOT).endsWith(".doc")) {
      return readWithTika(source, null);
    }
    try (InputStream in = Files.newInputStream(source.path());
        XWPFDocument doc = new XWPFDocument(in)) {
      String text = extractText(doc);
      List<ExtractedImage> images = options.skipImages() ? List.of() : extractImages(doc);
      log.debug(
          "DOCX {} read: {} chars, {} images", source.fileName(), text.length(), images.size());
      return new RawExtraction(text, images, null, false);
    } catch (IOException | RuntimeException e) {
      log.warn(
          "POI could not open {}, trying text-only recovery: {}",
          source.fileName(),
          e.getMessage());
      return readWithTika(source, e);
    }
  }

  @Override
  public boolean supports(SourceType type) {
    return type == SourceType.DOCX;
  }

  // ---- private helpers ----

  private RawExtraction readWithTika(SourceFile source, Exception original) {
    try {
      String text = tikaTextExtractor.extractText(source.path());
      if (original == null) {
        return RawExtraction.textOnly(text, null);
      }
      log.info("Recovered {} with text-only extraction", source.fileName());
      return RawExtraction.textOnly(text, null).asRecovered();
    } catch (IOException | RuntimeException e) {
      log.error("Error processing Word document {}: {}", source.fileName(), e.getMessage());
      if (original != null) {
        e.addSuppressed(original);
      }
      throw new CorruptInputException(
          SourceType.DOCX, "Failed to process Word document: " + e.getMessage(), e);
    }
  }

  private String extractText(XWPFDocument doc) {
    StringBuilder text = new StringBuilder();
    for (IBodyElement element : doc.getBodyElements()) {
      if (element instanceof XWPFParagraph paragraph) {
        text.append(paragraph.getText()).append("\n");
      } else if (element instanceof XWPFTable table) {
        for (XWPFTableRow row : table.getRows()) {
          for (XWPFTableCell cell : row.getTableCells()) {
            text.append(cell.getText()).append("\n");
          }
        }
      }
    }
    return text.toString();
  }

  private List<ExtractedImage> extractImages(XWPFDocument doc) {
    List<ExtractedImage> images = new ArrayList<>();
    for (XWPFPictureData picture : doc.getAllPictures()) {
      try {
        byte[] data = picture.getData();
        Optional<String> format = imageNormalizer.detectFormat(data);
        if (format.isEmpty() || ImageIO.read(new ByteArrayInputStream(data)) == null) {
          log.debug("Skipping undecodable picture {}", picture.getFileName());
          continue;
        }
        int index = images.size();
        images.add(
            ExtractedImage.of(
                "docx_image_" + index, "Image " + (index + 1), format.get(), data, -1));
      } catch (IOException | RuntimeException e) {
        log.error("Error extracting image from DOCX: {}", e.getMessage());
      }
    }
    return images;
  }
}
