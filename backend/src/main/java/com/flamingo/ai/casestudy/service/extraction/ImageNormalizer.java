package com.flamingo.ai.casestudy.service.extraction;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Re-encodes embedded images into JPEG or PNG.
 *
 * <p>JPEG stays JPEG and PNG stays PNG (alpha preserved). Any other format is flattened onto a
 * white background and written as JPEG. Images larger than the configured maximum dimension are
 * downscaled, preserving aspect ratio.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImageNormalizer {

  private final CaseStudyProperties properties;

  /**
   * Encoded image ready to be attached to a document.
   *
   * @param bytes encoded bytes
   * @param subtype {@code jpeg} or {@code png}
   * @param width pixel width after resizing
   * @param height pixel height after resizing
   */
  public record NormalizedImage(byte[] bytes, String subtype, int width, int height) {}

  /**
   * Decodes, filters, resizes and re-encodes one embedded image.
   *
   * @param data raw embedded bytes
   * @return the normalised image, or empty if it cannot be decoded or is below the minimum size
   */
  public Optional<NormalizedImage> normalize(byte[] data) {
    CaseStudyProperties.Pptx settings = properties.getPptx();
    Optional<String> format = detectFormat(data);
    if (format.isEmpty()) {
      log.debug("Skipping image in unrecognised format ({} bytes)", data.length);
      return Optional.empty();
    }

    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(data));
    } catch (IOException | RuntimeException e) {
      log.warn("Could not decode {} image: {}", format.get(), e.getMessage());
      return Optional.empty();
    }
    if (image == null) {
      return Optional.empty();
    }

    int width = image.getWidth();
    int height = image.getHeight();
    int min = settings.getMinImagePixels();
    if (width < min || height < min) {
      log.debug("Skipping small image ({}x{})", width, height);
      return Optional.empty();
    }

    String subtype = format.get();
    if (!"jpeg".equals(subtype) && !"png".equals(subtype)) {
      log.debug("Converting image from {} to JPEG", subtype);
      image = flattenOntoWhite(image);
      subtype = "jpeg";
    }

    int max = settings.getMaxImageDimension();
    if (width > max || height > max) {
      double ratio = Math.min((double) max / width, (double) max / height);
      image = resize(image, (int) (width * ratio), (int) (height * ratio));
      log.debug(
          "Resized image from {}x{} to {}x{}", width, height, image.getWidth(), image.getHeight());
    }

    try {
      byte[] encoded =
          "jpeg".equals(subtype) ? toJpeg(image, settings.getJpegQuality()) : toPng(image);
      return Optional.of(
          new NormalizedImage(encoded, subtype, image.getWidth(), image.getHeight()));
    } catch (IOException | RuntimeException e) {
      log.warn("Error saving image, trying JPEG fallback: {}", e.getMessage());
    }

    try {
      BufferedImage flat = flattenOntoWhite(image);
      byte[] encoded = toJpeg(flat, settings.getFallbackJpegQuality());
      return Optional.of(new NormalizedImage(encoded, "jpeg", flat.getWidth(), flat.getHeight()));
    } catch (IOException | RuntimeException e) {
      log.warn("JPEG fallback failed, dropping image: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Identifies the encoded format of an image from its header.
   *
   * @param data encoded bytes
   * @return lower-case format name ({@code jpeg}, {@code png}, {@code gif}, ...), or empty if no
   *     installed reader recognises the data
   */
  public Optional<String> detectFormat(byte[] data) {
    if (data == null || data.length == 0) {
      return Optional.empty();
    }
    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
      if (in == null) {
        return Optional.empty();
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
      if (!readers.hasNext()) {
        return Optional.empty();
      }
      ImageReader reader = readers.next();
      try {
        String name = reader.getFormatName().toLowerCase(Locale.ROOT);
        return Optional.of("jpg".equals(name) ? "jpeg" : name);
      } finally {
        reader.dispose();
      }
    } catch (IOException e) {
      log.debug("Image header not readable: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Encodes an image as JPEG at the given quality. Alpha is flattened onto white first.
   *
   * @param image source image
   * @param quality compression quality between 0 and 1
   * @return JPEG bytes
   * @throws IOException if no JPEG writer is available or writing fails
   */
  public byte[] toJpeg(BufferedImage image, float quality) throws IOException {
    BufferedImage rgb =
        image.getType() == BufferedImage.TYPE_INT_RGB ? image : flattenOntoWhite(image);
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IOException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (ImageOutputStream out = ImageIO.createImageOutputStream(baos)) {
      writer.setOutput(out);
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(quality);
      writer.write(null, new IIOImage(rgb, null, null), param);
    } finally {
      writer.dispose();
    }
    return baos.toByteArray();
  }

  public byte[] toPng(BufferedImage image) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    if (!ImageIO.write(image, "png", baos)) {
      throw new IOException("No PNG writer available");
    }
    return baos.toByteArray();
  }

  // ---- private helpers ----

  private BufferedImage flattenOntoWhite(BufferedImage source) {
    BufferedImage flat =
        new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = flat.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, source.getWidth(), source.getHeight());
      g.drawImage(source, 0, 0, null);
    } finally {
      g.dispose();
    }
    return flat;
  }

  private BufferedImage resize(BufferedImage source, int width, int height) {
    try {
      return draw(source, width, height, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
    } catch (RuntimeException e) {
      log.warn("Bicubic resize failed, using bilinear: {}", e.getMessage());
      return draw(source, width, height, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
    }
  }

  private BufferedImage draw(BufferedImage source, int width, int height, Object interpolation) {
    boolean alpha = source.getColorModel().hasAlpha();
    int type = alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    BufferedImage target = new BufferedImage(Math.max(1, width), Math.max(1, height), type);
    Graphics2D g = target.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.drawImage(source, 0, 0, target.getWidth(), target.getHeight(), null);
    } finally {
      g.dispose();
    }
    return target;
  }
}
