package ch.bergturbenthal.gallery.server.interfaces;

import ch.bergturbenthal.gallery.libs.model.Asset;
import java.io.InputStream;
import org.jetbrains.annotations.NotNull;
import org.springframework.core.io.AbstractResource;

public class AssetResource extends AbstractResource {

  private final Asset asset;
  private final String routeKey;

  public AssetResource(final Asset asset, final String routeKey) {
    this.asset = asset;
    this.routeKey = routeKey;
  }

  @Override
  public @NotNull InputStream getInputStream() {
    return asset.openStream();
  }

  @Override
  public boolean exists() {
    return true;
  }

  @Override
  public long contentLength() {
    return asset.getSize();
  }

  @Override
  public String getFilename() {
    return routeKey.substring(routeKey.lastIndexOf('/') + 1);
  }

  @Override
  public @NotNull String getDescription() {
    return "gallery asset " + routeKey;
  }
}
