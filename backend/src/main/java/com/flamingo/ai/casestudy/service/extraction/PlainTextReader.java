package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.exception.DecodeFailureException;
import com.flamingo.ai.casestudy.exception.DocumentProcessingException;
import com.flamingo.ai.casestudy.exception.ErrorCategory;
import com.flamingo.ai.casestudy.service.extraction.model.RawExtraction;
import com.flamingo.ai.casestudy.service.extraction.model.ReadOptions;
import com.flamingo.ai.casestudy.service.extraction.model.SourceFile;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link FormatReader} for plain text files.
 *
 * <p>Each configured encoding is tried in order with a strict decoder; the first one that decodes
 * the whole file wins.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlainTextReader implements FormatReader {

  private final CaseStudyProperties properties;

  @Override
  public RawExtraction read(SourceFile source, ReadOptions options) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(source.path());
    } catch (IOException e) {
      throw new DocumentProcessingException(
          ErrorCategory.CORRUPT_INPUT,
          "Failed to read " + source.fileName() + ": " + e.getMessage(),
          "The text file could not be read.",
          e);
    }
    return RawExtraction.textOnly(decode(bytes, source.fileName()), null);
  }

  @Override
  public boolean supports(SourceType type) {
    return type == SourceType.TXT;
  }

  /**
   * Decodes bytes with the first configured encoding that accepts them.
   *
   * @param bytes file contents
   * @param fileName name used in log and error messages
   * @return decoded text
   * @throws DecodeFailureException if no configured encoding accepts the bytes
   */
  String decode(byte[] bytes, String fileName) {
    List<String> encodings = properties.getText().getEncodings();
    for (String encoding : encodings) {
      try {
        String text =
            Charset.forName(encoding)
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        if (!encodings.get(0).equals(encoding)) {
          log.info("Successfully read {} with encoding {}", fileName, encoding);
        }
        return text;
      } catch (CharacterCodingException e) {
        log.warn("Could not decode {} as {}, trying next encoding", fileName, encoding);
      } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
        log.warn("Skipping unknown encoding {}", encoding);
      }
    }
    log.error("Failed to decode {} with any encoding", fileName);
    throw new DecodeFailureException(fileName, encodings);
  }
}
