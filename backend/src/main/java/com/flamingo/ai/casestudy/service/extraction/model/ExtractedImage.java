package com.flamingo.ai.casestudy.service.extraction.model;

import java.util.Objects;

/**
 * An image pulled out of a source document, already normalised to a web-friendly encoding.
 *
 * <p>Instances are immutable; {@link #withSelectedForNarrative(boolean)} returns a copy with the
 * selection flag changed, which is the only attribute that may differ between copies of the same
 * image.
 *
 * @param id identifier unique within the owning document (e.g. {@code pptx_image_3})
 * @param caption human-readable caption or alt-text
 * @param mimeSubtype image subtype such as {@code jpeg} or {@code png}
 * @param bytes encoded image bytes
 * @param sourceIndex 0-based page or slide the image came from ({@code -1} if unknown)
 * @param selectedForNarrative whether the image was chosen for a case study
 */
public record ExtractedImage(
    String id,
    String caption,
    String mimeSubtype,
    byte[] bytes,
    int sourceIndex,
    boolean selectedForNarrative) {

  public ExtractedImage {
    Objects.requireNonNull(id, "id");
    caption = caption != null ? caption : "";
    mimeSubtype = mimeSubtype != null ? mimeSubtype : "jpeg";
    bytes = bytes != null ? bytes : new byte[0];
  }

  /**
   * Factory for a freshly extracted, not-yet-selected image.
   *
   * @param id image id
   * @param caption caption text
   * @param mimeSubtype encoded format
   * @param bytes encoded bytes
   * @param sourceIndex page or slide index, {@code -1} if unknown
   * @return the new image
   */
  public static ExtractedImage of(
      String id, String caption, String mimeSubtype, byte[] bytes, int sourceIndex) {
    return new ExtractedImage(id, caption, mimeSubtype, bytes, sourceIndex, false);
  }

  public ExtractedImage withSelectedForNarrative(boolean selected) {
    return new ExtractedImage(id, caption, mimeSubtype, bytes, sourceIndex, selected);
  }

  public ExtractedImage withId(String newId) {
    return new ExtractedImage(
        newId, caption, mimeSubtype, bytes, sourceIndex, selectedForNarrative);
  }

  public String mimeType() {
    return "image/" + mimeSubtype;
  }
}
