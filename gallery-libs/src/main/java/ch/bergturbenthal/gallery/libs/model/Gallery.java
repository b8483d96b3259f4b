package ch.bergturbenthal.gallery.libs.model;

import java.util.List;
import java.util.Optional;
import lombok.Value;

/** Read-only result of a finished build, handed to the serving layer. */
@Value
public class Gallery {
  AssetTable assets;
  List<GalleryEntry> entries;
  String archiveRouteKey;
  int candidateCount;
  int failureCount;

  public Gallery(
      final AssetTable assets,
      final List<GalleryEntry> entries,
      final String archiveRouteKey,
      final int candidateCount,
      final int failureCount) {
    this.assets = assets;
    this.entries = List.copyOf(entries);
    this.archiveRouteKey = archiveRouteKey;
    this.candidateCount = candidateCount;
    this.failureCount = failureCount;
  }

  public Optional<Asset> find(final String routeKey) {
    return assets.get(routeKey);
  }
}
