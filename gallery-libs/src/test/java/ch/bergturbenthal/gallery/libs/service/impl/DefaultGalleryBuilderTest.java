package ch.bergturbenthal.gallery.libs.service.impl;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.bergturbenthal.gallery.libs.TestImages;
import ch.bergturbenthal.gallery.libs.model.Asset;
import ch.bergturbenthal.gallery.libs.model.Gallery;
import ch.bergturbenthal.gallery.libs.model.GalleryEntry;
import ch.bergturbenthal.gallery.libs.model.SourceImage;
import ch.bergturbenthal.gallery.libs.properties.GalleryProperties;
import ch.bergturbenthal.gallery.libs.service.TranscodeWorker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

class DefaultGalleryBuilderTest {
  @TempDir Path directory;
  private GalleryProperties properties;
  private MeterRegistry meterRegistry;
  private ExecutorService executorService;

  @BeforeEach
  void setUp() {
    properties = new GalleryProperties();
    meterRegistry = new SimpleMeterRegistry();
    executorService = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  private DefaultGalleryBuilder createBuilder(final TranscodeWorker worker) {
    return new DefaultGalleryBuilder(
        new DefaultDirectoryScanner(properties),
        new ExecutorWorkerPool(executorService, worker),
        properties,
        meterRegistry);
  }

  private DefaultGalleryBuilder createBuilder() {
    return createBuilder(new ImageIoTranscodeWorker(properties, meterRegistry));
  }

  @Test
  void buildsGalleryOfValidImagesOnly() throws Exception {
    properties.setSortByName(true);
    final Path a = TestImages.writeJpeg(directory, "a.jpg", 1200, 800);
    final Path b = TestImages.writeJpeg(directory, "b.jpeg", 400, 300);
    TestImages.writeBytes(directory, "c.txt", "ignored".getBytes(StandardCharsets.UTF_8));
    TestImages.writeBytes(directory, "d.jpg", "corrupt".getBytes(StandardCharsets.UTF_8));

    final Gallery gallery = createBuilder().build(directory);

    assertEquals(3, gallery.getCandidateCount());
    assertEquals(1, gallery.getFailureCount());
    assertEquals(
        List.of(
            new GalleryEntry("a", "/preview/a.jpg", "/a.jpg"),
            new GalleryEntry("b", "/preview/b.jpg", "/b.jpeg")),
        gallery.getEntries());
    assertFalse(gallery.find("/d.jpg").isPresent());
    assertEquals("/gallery.zip", gallery.getArchiveRouteKey());

    final Map<String, byte[]> archived =
        ZipArchiveBuilderTest.readEntries(
            gallery.find(gallery.getArchiveRouteKey()).orElseThrow().asByteBuffer());
    assertEquals(List.of("a.jpg", "b.jpeg"), new ArrayList<>(archived.keySet()));
    assertArrayEquals(Files.readAllBytes(a), archived.get("a.jpg"));
    assertArrayEquals(Files.readAllBytes(b), archived.get("b.jpeg"));

    for (GalleryEntry entry : gallery.getEntries()) {
      final Asset full = gallery.find(entry.getFullRouteKey()).orElseThrow();
      final Asset preview = gallery.find(entry.getPreviewRouteKey()).orElseThrow();
      assertTrue(full.getSize() > 0);
      assertTrue(preview.getSize() > 0);
      assertEquals(Asset.IMAGE_JPEG, full.getContentType());
      assertEquals(Asset.IMAGE_JPEG, preview.getContentType());
    }
    assertEquals(1, meterRegistry.timer("gallery.build").count());
  }

  @Test
  void orderFollowsScanOrderWhateverTheCompletionOrder() throws Exception {
    for (int i = 0; i < 12; i++) {
      TestImages.writeJpeg(directory, "image-" + i + ".jpg", 64 + i, 48);
    }
    final List<String> scanOrder =
        new DefaultDirectoryScanner(properties)
            .scan(directory).stream()
                .map(SourceImage::getDisplayName)
                .collect(Collectors.toList());
    final ImageIoTranscodeWorker realWorker = new ImageIoTranscodeWorker(properties, meterRegistry);
    final TranscodeWorker slowWorker =
        source -> {
          try {
            Thread.sleep(ThreadLocalRandom.current().nextInt(30));
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return realWorker.transcode(source);
        };

    for (int run = 0; run < 3; run++) {
      final Gallery gallery = createBuilder(slowWorker).build(directory);
      assertEquals(
          scanOrder,
          gallery.getEntries().stream()
              .map(GalleryEntry::getDisplayName)
              .collect(Collectors.toList()));
      final Map<String, byte[]> archived =
          ZipArchiveBuilderTest.readEntries(
              gallery.find(gallery.getArchiveRouteKey()).orElseThrow().asByteBuffer());
      assertEquals(
          scanOrder.stream().map(n -> n + ".jpg").collect(Collectors.toList()),
          new ArrayList<>(archived.keySet()));
    }
  }

  @Test
  void crashingWorkerDoesNotBlockTheBuild() throws Exception {
    TestImages.writeJpeg(directory, "ok.jpg", 100, 100);
    TestImages.writeJpeg(directory, "boom.jpg", 100, 100);
    final ImageIoTranscodeWorker realWorker = new ImageIoTranscodeWorker(properties, meterRegistry);
    final TranscodeWorker crashingWorker =
        source -> {
          if (source.getFilename().equals("boom.jpg")) {
            throw new IllegalArgumentException("simulated crash");
          }
          return realWorker.transcode(source);
        };

    final Gallery gallery = createBuilder(crashingWorker).build(directory);

    assertEquals(2, gallery.getCandidateCount());
    assertEquals(1, gallery.getFailureCount());
    assertEquals("ok", gallery.getEntries().get(0).getDisplayName());
  }

  @Test
  void workerErrorStillCompletesTheBuild() throws Exception {
    TestImages.writeJpeg(directory, "ok.jpg", 100, 100);
    TestImages.writeJpeg(directory, "huge.jpg", 100, 100);
    final ImageIoTranscodeWorker realWorker = new ImageIoTranscodeWorker(properties, meterRegistry);
    final TranscodeWorker failingWorker =
        source -> {
          if (source.getFilename().equals("huge.jpg")) {
            throw new OutOfMemoryError("Required array size too large");
          }
          return realWorker.transcode(source);
        };
    final DefaultGalleryBuilder builder = createBuilder(failingWorker);

    final Gallery gallery =
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> builder.build(directory));

    assertEquals(2, gallery.getCandidateCount());
    assertEquals(1, gallery.getFailureCount());
    assertEquals(1, gallery.getEntries().size());
    assertEquals("ok", gallery.getEntries().get(0).getDisplayName());
    assertFalse(gallery.find("/huge.jpg").isPresent());
  }

  @Test
  void oversizedImageIsSkipped() throws Exception {
    properties.setSortByName(true);
    properties.setMaxImageSize(DataSize.ofKilobytes(20));
    TestImages.writeJpeg(directory, "a.jpg", 64, 64);
    final byte[] padded = new byte[30 * 1024];
    final byte[] small = Files.readAllBytes(directory.resolve("a.jpg"));
    System.arraycopy(small, 0, padded, 0, small.length);
    TestImages.writeBytes(directory, "b.jpg", padded);

    final Gallery gallery = createBuilder().build(directory);

    assertEquals(2, gallery.getCandidateCount());
    assertEquals(1, gallery.getFailureCount());
    assertEquals("a", gallery.getEntries().get(0).getDisplayName());
  }

  @Test
  void emptyDirectoryGivesEmptyGallery() throws Exception {
    final Gallery gallery = createBuilder().build(directory);
    assertEquals(0, gallery.getCandidateCount());
    assertTrue(gallery.getEntries().isEmpty());
    assertTrue(gallery.find("/gallery.zip").isPresent());
  }

  @Test
  void unlistableDirectoryAbortsTheBuild() {
    final DefaultGalleryBuilder builder = createBuilder();
    assertThrows(IOException.class, () -> builder.build(directory.resolve("missing")));
  }
}
