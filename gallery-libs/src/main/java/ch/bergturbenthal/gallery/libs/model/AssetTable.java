package ch.bergturbenthal.gallery.libs.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Frozen mapping from route key to {@link Asset}. Instances are only created by {@link Builder} and
 * never change afterwards, so lookups need no synchronization.
 */
public final class AssetTable {
  private final Map<String, Asset> assets;

  private AssetTable(final Map<String, Asset> assets) {
    this.assets = Map.copyOf(assets);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<Asset> get(final String routeKey) {
    if (routeKey == null) return Optional.empty();
    return Optional.ofNullable(assets.get(routeKey));
  }

  public int size() {
    return assets.size();
  }

  @Override
  public String toString() {
    return "AssetTable" + assets.keySet();
  }

  /** Single-writer builder; not thread safe. */
  public static class Builder {
    private final Map<String, Asset> pending = new LinkedHashMap<>();
    private boolean frozen = false;

    private Builder() {}

    public Builder put(final String routeKey, final Asset asset) {
      if (frozen) {
        throw new IllegalStateException("Asset table already frozen, cannot add " + routeKey);
      }
      if (pending.putIfAbsent(routeKey, asset) != null) {
        throw new IllegalStateException("Duplicate route key " + routeKey);
      }
      return this;
    }

    public boolean contains(final String routeKey) {
      return pending.containsKey(routeKey);
    }

    public AssetTable build() {
      if (frozen) {
        throw new IllegalStateException("Asset table already frozen");
      }
      frozen = true;
      return new AssetTable(pending);
    }
  }
}
