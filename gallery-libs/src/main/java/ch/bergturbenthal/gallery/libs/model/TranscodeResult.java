package ch.bergturbenthal.gallery.libs.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.ToString;
import lombok.Value;

/**
 * Outcome of transcoding one {@link SourceImage}. Either both byte arrays are set, or {@code error}
 * is set. The byte arrays are handed over to whoever consumes the result and must not be modified.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TranscodeResult {
  int ordinal;
  String filename;
  String displayName;

  @ToString.Exclude byte[] previewBytes;
  @ToString.Exclude byte[] fullBytes;
  String error;

  public static TranscodeResult success(
      final SourceImage source, final byte[] previewBytes, final byte[] fullBytes) {
    return new TranscodeResult(
        source.getOrdinal(),
        source.getFilename(),
        source.getDisplayName(),
        previewBytes,
        fullBytes,
        null);
  }

  public static TranscodeResult failure(final SourceImage source, final String error) {
    return new TranscodeResult(
        source.getOrdinal(), source.getFilename(), source.getDisplayName(), null, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
