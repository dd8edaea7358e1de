package com.flamingo.ai.casestudy.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.service.extraction.ImageNormalizer.NormalizedImage;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ImageNormalizer Tests")
class ImageNormalizerTest {

  private ImageNormalizer normalizer;

  @BeforeEach
  void setUp() {
    normalizer = new ImageNormalizer(new CaseStudyProperties());
  }

  @Test
  @DisplayName("should keep PNG as PNG")
  void shouldKeepPng_whenPngInput() throws Exception {
    Optional<NormalizedImage> result = normalizer.normalize(TestImages.png(200, 100));

    assertThat(result).isPresent();
    assertThat(result.get().subtype()).isEqualTo("png");
    assertThat(result.get().width()).isEqualTo(200);
    assertThat(result.get().height()).isEqualTo(100);
  }

  @Test
  @DisplayName("should convert GIF to JPEG")
  void shouldConvertToJpeg_whenGifInput() throws Exception {
    byte[] gif = encode(TestImages.solid(120, 120, Color.GREEN), "gif");

    Optional<NormalizedImage> result = normalizer.normalize(gif);

    assertThat(result).isPresent();
    assertThat(result.get().subtype()).isEqualTo("jpeg");
    assertThat(normalizer.detectFormat(result.get().bytes())).contains("jpeg");
  }

  @Test
  @DisplayName("should downscale images above the maximum dimension")
  void shouldResize_whenLargerThanMaximum() throws Exception {
    byte[] jpeg = encode(TestImages.solid(2000, 500, Color.RED), "jpeg");

    NormalizedImage result = normalizer.normalize(jpeg).orElseThrow();

    assertThat(result.subtype()).isEqualTo("jpeg");
    assertThat(result.width()).isEqualTo(1000);
    assertThat(result.height()).isEqualTo(250);
  }

  @Test
  @DisplayName("should skip images below the minimum size")
  void shouldSkip_whenTooSmall() throws Exception {
    assertThat(normalizer.normalize(TestImages.png(40, 400))).isEmpty();
  }

  @Test
  @DisplayName("should skip bytes that are not an image")
  void shouldSkip_whenNotAnImage() {
    byte[] garbage = "definitely not an image".getBytes(StandardCharsets.UTF_8);

    assertThat(normalizer.detectFormat(garbage)).isEmpty();
    assertThat(normalizer.normalize(garbage)).isEmpty();
  }

  @Test
  @DisplayName("should report jpeg for JPEG headers")
  void shouldDetectJpeg() throws Exception {
    byte[] jpeg = encode(TestImages.solid(60, 60, Color.BLACK), "jpeg");

    assertThat(normalizer.detectFormat(jpeg)).contains("jpeg");
    assertThat(normalizer.detectFormat(new byte[0])).isEmpty();
  }

  private static byte[] encode(BufferedImage image, String format) throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(image, format, out);
    return out.toByteArray();
  }
}
