package ch.bergturbenthal.gallery.libs.model;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.ByteBuffer;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Immutable content of one route. The backing array is owned by the asset and never handed out;
 * callers only get independent read-only views of it.
 */
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Asset {
  public static final String IMAGE_JPEG = "image/jpeg";
  public static final String APPLICATION_ZIP = "application/zip";

  private final byte[] content;
  @ToString.Include @EqualsAndHashCode.Include private final String contentType;

  /** Takes ownership of {@code content}; the caller must not modify the array afterwards. */
  public Asset(final byte[] content, final String contentType) {
    this.content = content;
    this.contentType = contentType;
  }

  public String getContentType() {
    return contentType;
  }

  @ToString.Include
  public int getSize() {
    return content.length;
  }

  public ByteBuffer asByteBuffer() {
    return ByteBuffer.wrap(content).asReadOnlyBuffer();
  }

  public InputStream openStream() {
    return new ByteArrayInputStream(content);
  }

  public byte[] toByteArray() {
    return content.clone();
  }
}
