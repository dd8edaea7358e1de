package com.flamingo.ai.casestudy.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.flamingo.ai.casestudy.exception.UnsupportedFormatException;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FormatReaderRouter Tests")
class FormatReaderRouterTest {

  @Test
  @DisplayName("should pick the first reader supporting the format")
  void shouldRouteToSupportingReader() {
    FormatReader pdf = mock(FormatReader.class);
    FormatReader text = mock(FormatReader.class);
    when(pdf.supports(SourceType.TXT)).thenReturn(false);
    when(text.supports(SourceType.TXT)).thenReturn(true);

    FormatReaderRouter router = new FormatReaderRouter(List.of(pdf, text));

    assertThat(router.route(SourceType.TXT)).isSameAs(text);
  }

  @Test
  @DisplayName("should throw when no reader supports the format")
  void shouldThrow_whenUnsupported() {
    FormatReaderRouter router = new FormatReaderRouter(List.of());

    assertThatThrownBy(() -> router.route(SourceType.PPTX))
        .isInstanceOf(UnsupportedFormatException.class)
        .hasMessageContaining("pptx");
  }
}
