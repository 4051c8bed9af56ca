package sentry.envelope;

import java.util.Arrays;
import java.util.Objects;

/**
 * Binary file sent alongside an event.
 */
public final class Attachment {
  public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private final String filename;
  private final String contentType;
  private final byte[] data;

  public Attachment(String filename, String contentType, byte[] data) {
    this.filename = Objects.requireNonNull(filename, "filename");
    this.contentType = contentType == null ? DEFAULT_CONTENT_TYPE : contentType;
    Objects.requireNonNull(data, "data");
    this.data = Arrays.copyOf(data, data.length);
  }

  public String filename() {
    return filename;
  }

  public String contentType() {
    return contentType;
  }

  public byte[] data() {
    return Arrays.copyOf(data, data.length);
  }

  public int size() {
    return data.length;
  }

  /**
   * Converts this attachment into an envelope item.
   *
   * @param maxAttachmentSize largest accepted payload in bytes
   * @return an {@code attachment} item
   * @throws IllegalArgumentException if the data exceeds {@code maxAttachmentSize}
   */
  public EnvelopeItem toEnvelopeItem(int maxAttachmentSize) {
    if (data.length > maxAttachmentSize) {
      throw new IllegalArgumentException("Attachment " + filename + " is " + data.length
          + " bytes, exceeds maximum of " + maxAttachmentSize);
    }
    return new EnvelopeItem(
        new EnvelopeItemHeader(EnvelopeItemHeader.TYPE_ATTACHMENT, filename, contentType), data);
  }

  @Override
  public String toString() {
    return "Attachment{filename=" + filename + ", contentType=" + contentType + ", size=" + data.length + "}";
  }
}
