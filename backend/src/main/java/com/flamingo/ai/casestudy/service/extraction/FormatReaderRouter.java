package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.exception.UnsupportedFormatException;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a {@link SourceType} to the {@link FormatReader} that supports it.
 *
 * <p>{@link DocumentProcessor} depends on this router only, never on concrete readers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FormatReaderRouter {

  private final List<FormatReader> readers;

  /**
   * Returns the first reader that supports the given format.
   *
   * @param type source format
   * @return selected reader
   * @throws UnsupportedFormatException if no reader supports the format
   */
  public FormatReader route(SourceType type) {
    return readers.stream()
        .filter(r -> r.supports(type))
        .findFirst()
        .orElseThrow(() -> new UnsupportedFormatException(type.name().toLowerCase(Locale.ROOT)));
  }
}
