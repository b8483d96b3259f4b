package ch.bergturbenthal.gallery.libs.service.impl;

import ch.bergturbenthal.gallery.libs.model.Asset;
import ch.bergturbenthal.gallery.libs.model.SourceImage;
import ch.bergturbenthal.gallery.libs.model.TranscodeResult;
import ch.bergturbenthal.gallery.libs.properties.GalleryProperties;
import ch.bergturbenthal.gallery.libs.service.TranscodeWorker;
import io.micrometer.core.instrument.MeterRegistry;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.tika.Tika;
import org.jetbrains.annotations.NotNull;
import org.springframework.stereotype.Service;

/**
 * Reads one JPEG, decodes it subsampled so it fits into the preview bounds and encodes the result
 * as a lossy JPEG preview. The original bytes are returned untouched.
 */
@Slf4j
@Service
public class ImageIoTranscodeWorker implements TranscodeWorker {
  private static final String JPEG_FORMAT = "jpeg";
  private static final long MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;
  private final Tika tika = new Tika();
  private final int maxWidth;
  private final int maxHeight;
  private final float quality;
  private final long maxImageBytes;
  private final MeterRegistry meterRegistry;

  public ImageIoTranscodeWorker(
      final GalleryProperties properties, final MeterRegistry meterRegistry) {
    if (properties.getPreviewMaxWidth() < 1 || properties.getPreviewMaxHeight() < 1) {
      throw new IllegalArgumentException(
          "Invalid preview bounds "
              + properties.getPreviewMaxWidth()
              + "x"
              + properties.getPreviewMaxHeight());
    }
    if (properties.getPreviewQuality() < 0 || properties.getPreviewQuality() > 100) {
      throw new IllegalArgumentException(
          "Preview quality must be within 0..100: " + properties.getPreviewQuality());
    }
    if (properties.getMaxImageSize().toBytes() > MAX_ARRAY_SIZE) {
      throw new IllegalArgumentException(
          "Max image size must not exceed " + MAX_ARRAY_SIZE + " bytes");
    }
    this.maxImageBytes = properties.getMaxImageSize().toBytes();
    this.maxWidth = properties.getPreviewMaxWidth();
    this.maxHeight = properties.getPreviewMaxHeight();
    this.quality = properties.getPreviewQuality() / 100f;
    this.meterRegistry = meterRegistry;
  }

  static int subsamplingFactor(
      final int width, final int height, final int maxWidth, final int maxHeight) {
    final int horizontal = (width + maxWidth - 1) / maxWidth;
    final int vertical = (height + maxHeight - 1) / maxHeight;
    return Math.max(1, Math.max(horizontal, vertical));
  }

  @Override
  public TranscodeResult transcode(final SourceImage source) {
    final long startTime = System.nanoTime();
    try {
      final long size = Files.size(source.getPath());
      if (size > maxImageBytes) {
        throw new IOException(
            "Image has " + size + " bytes, more than the limit of " + maxImageBytes);
      }
      final byte[] original = FileUtils.readFileToByteArray(source.getPath().toFile());
      final String detectedType = tika.detect(original);
      if (!Asset.IMAGE_JPEG.equals(detectedType)) {
        throw new IOException("Not a JPEG image, content detected as " + detectedType);
      }
      final BufferedImage preview = decodeScaled(original);
      final byte[] previewBytes = encodePreview(preview);
      record("ok", startTime);
      return TranscodeResult.success(source, previewBytes, original);
    } catch (IOException | RuntimeException e) {
      // decoders report broken streams with all kinds of runtime exceptions
      log.debug("Cannot transcode {}", source.getPath(), e);
      record("failed", startTime);
      return TranscodeResult.failure(source, describe(e));
    }
  }

  @NotNull
  private BufferedImage decodeScaled(final byte[] data) throws IOException {
    final Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(JPEG_FORMAT);
    if (!readers.hasNext()) throw new IOException("No JPEG decoder available");
    final ImageReader reader = readers.next();
    try (ImageInputStream input = new MemoryCacheImageInputStream(new ByteArrayInputStream(data))) {
      reader.setInput(input, true, true);
      final int width = reader.getWidth(0);
      final int height = reader.getHeight(0);
      final int factor = subsamplingFactor(width, height, maxWidth, maxHeight);
      final ImageReadParam param = reader.getDefaultReadParam();
      param.setSourceSubsampling(factor, factor, 0, 0);
      final BufferedImage image = reader.read(0, param);
      if (image == null) throw new IOException("Decoder returned no image");
      return image;
    } finally {
      reader.dispose();
    }
  }

  @NotNull
  private byte[] encodePreview(final BufferedImage image) throws IOException {
    final Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(JPEG_FORMAT);
    if (!writers.hasNext()) throw new IOException("No JPEG encoder available");
    final ImageWriter writer = writers.next();
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ImageOutputStream output = new MemoryCacheImageOutputStream(out)) {
      final ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(quality);
      writer.setOutput(output);
      writer.write(null, new IIOImage(image, null, null), param);
    } finally {
      writer.dispose();
    }
    return out.toByteArray();
  }

  private static String describe(final Exception e) {
    final String message = e.getMessage();
    return message == null ? e.getClass().getSimpleName() : message;
  }

  private void record(final String result, final long startTime) {
    meterRegistry
        .timer("gallery.transcode", "result", result)
        .record(Duration.ofNanos(System.nanoTime() - startTime));
  }
}
