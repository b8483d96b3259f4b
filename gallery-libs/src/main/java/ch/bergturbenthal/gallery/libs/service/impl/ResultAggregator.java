package ch.bergturbenthal.gallery.libs.service.impl;

import ch.bergturbenthal.gallery.libs.model.Asset;
import ch.bergturbenthal.gallery.libs.model.AssetTable;
import ch.bergturbenthal.gallery.libs.model.Gallery;
import ch.bergturbenthal.gallery.libs.model.GalleryEntry;
import ch.bergturbenthal.gallery.libs.model.RouteKeys;
import ch.bergturbenthal.gallery.libs.model.TranscodeResult;
import ch.bergturbenthal.gallery.libs.service.ArchiveBuilder;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * Consumes the completion queue of one build. All archive and asset table mutation happens here,
 * on the thread calling {@link #aggregate}, so none of it needs locking.
 *
 * <p>Results are slotted by ordinal while they arrive; the archive, the asset table and the entry
 * list are only written once all expected results are in, in ordinal order.
 */
@Slf4j
public class ResultAggregator {
  private final ArchiveBuilder archiveBuilder;
  private final String archiveRouteKey;

  public ResultAggregator(final ArchiveBuilder archiveBuilder, final String archiveRouteKey) {
    this.archiveBuilder = archiveBuilder;
    this.archiveRouteKey = archiveRouteKey;
  }

  public Gallery aggregate(final BlockingQueue<TranscodeResult> completions, final int expected)
      throws InterruptedException, IOException {
    final TranscodeResult[] slots = new TranscodeResult[expected];
    int failureCount = 0;
    for (int received = 0; received < expected; received++) {
      final TranscodeResult result = completions.take();
      final int ordinal = result.getOrdinal();
      if (ordinal < 0 || ordinal >= expected) {
        throw new IllegalStateException(
            "Result for " + result.getFilename() + " has ordinal " + ordinal + " of " + expected);
      }
      if (slots[ordinal] != null) {
        throw new IllegalStateException(
            "Second result for ordinal " + ordinal + " (" + result.getFilename() + ")");
      }
      slots[ordinal] = result;
      if (!result.isSuccess()) {
        log.warn("Skipping {}: {}", result.getFilename(), result.getError());
        failureCount++;
      }
    }

    final AssetTable.Builder assets = AssetTable.builder();
    final List<GalleryEntry> entries = new ArrayList<>(expected - failureCount);
    for (TranscodeResult result : slots) {
      if (!result.isSuccess()) continue;
      final String fullRouteKey = RouteKeys.fullImage(result.getFilename());
      final String previewRouteKey = RouteKeys.preview(result.getDisplayName());
      if (assets.contains(previewRouteKey) || assets.contains(fullRouteKey)) {
        log.warn(
            "Skipping {}: route {} is already taken by an earlier image",
            result.getFilename(),
            previewRouteKey);
        failureCount++;
        continue;
      }
      archiveBuilder.append(result.getFilename(), result.getFullBytes());
      assets.put(fullRouteKey, new Asset(result.getFullBytes(), Asset.IMAGE_JPEG));
      assets.put(previewRouteKey, new Asset(result.getPreviewBytes(), Asset.IMAGE_JPEG));
      entries.add(new GalleryEntry(result.getDisplayName(), previewRouteKey, fullRouteKey));
    }
    if (archiveBuilder.getEntryCount() != entries.size()) {
      throw new IllegalStateException(
          "Archive has "
              + archiveBuilder.getEntryCount()
              + " entries but the gallery lists "
              + entries.size());
    }
    assets.put(archiveRouteKey, archiveBuilder.finish());

    return new Gallery(assets.build(), entries, archiveRouteKey, expected, failureCount);
  }
}
