package ch.bergturbenthal.gallery.libs.service.impl;

import ch.bergturbenthal.gallery.libs.model.Gallery;
import ch.bergturbenthal.gallery.libs.model.RouteKeys;
import ch.bergturbenthal.gallery.libs.model.SourceImage;
import ch.bergturbenthal.gallery.libs.model.TranscodeResult;
import ch.bergturbenthal.gallery.libs.properties.GalleryProperties;
import ch.bergturbenthal.gallery.libs.service.DirectoryScanner;
import ch.bergturbenthal.gallery.libs.service.GalleryBuilder;
import ch.bergturbenthal.gallery.libs.service.WorkerPool;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DefaultGalleryBuilder implements GalleryBuilder {
  private final DirectoryScanner directoryScanner;
  private final WorkerPool workerPool;
  private final MeterRegistry meterRegistry;
  private final String archiveRouteKey;

  public DefaultGalleryBuilder(
      final DirectoryScanner directoryScanner,
      final WorkerPool workerPool,
      final GalleryProperties properties,
      final MeterRegistry meterRegistry) {
    this.directoryScanner = directoryScanner;
    this.workerPool = workerPool;
    this.meterRegistry = meterRegistry;
    this.archiveRouteKey = RouteKeys.archive(properties.getArchiveName());
  }

  @Override
  public Gallery build(final Path directory) throws IOException, InterruptedException {
    final Instant startTime = Instant.now();
    final List<SourceImage> sources = directoryScanner.scan(directory);
    log.info("Found {} images in {}", sources.size(), directory.toAbsolutePath());

    final BlockingQueue<TranscodeResult> completions = new LinkedBlockingQueue<>();
    final ExecutorService aggregatorExecutor =
        Executors.newSingleThreadExecutor(new CustomizableThreadFactory("gallery-aggregator-"));
    try {
      final ResultAggregator aggregator =
          new ResultAggregator(new ZipArchiveBuilder(), archiveRouteKey);
      final Future<Gallery> pendingGallery =
          aggregatorExecutor.submit(() -> aggregator.aggregate(completions, sources.size()));
      workerPool.transcodeAll(sources, completions);

      final Gallery gallery = pendingGallery.get();
      final Duration buildTime = Duration.between(startTime, Instant.now());
      meterRegistry.timer("gallery.build").record(buildTime);
      log.info(
          "Gallery ready in {} ms: {} images, {} failed, {} routes",
          buildTime.toMillis(),
          gallery.getEntries().size(),
          gallery.getFailureCount(),
          gallery.getAssets().size());
      return gallery;
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof IOException) throw (IOException) cause;
      if (cause instanceof RuntimeException) throw (RuntimeException) cause;
      if (cause instanceof Error) throw (Error) cause;
      throw new IllegalStateException("Cannot aggregate gallery of " + directory, cause);
    } finally {
      aggregatorExecutor.shutdownNow();
    }
  }
}
