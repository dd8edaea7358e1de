package com.flamingo.ai.casestudy.service.extraction;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Component;

/**
 * Plain-text extraction through Apache Tika, used for legacy {@code .doc} files and as the
 * text-only recovery pass for Word containers POI cannot open.
 */
@Component
@Slf4j
public class TikaTextExtractor {

  private final Tika tika;

  public TikaTextExtractor() {
    this.tika = new Tika();
    this.tika.setMaxStringLength(-1);
  }

  /**
   * Extracts all text from a file.
   *
   * @param path file to read
   * @return extracted text
   * @throws IOException if the file cannot be read or parsed
   */
  public String extractText(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      String text = tika.parseToString(in);
      log.debug("Tika extracted {} chars from {}", text.length(), path.getFileName());
      return text;
    } catch (TikaException e) {
      throw new IOException("Tika could not parse " + path.getFileName(), e);
    }
  }
}
