package ch.bergturbenthal.gallery.libs.model;

import lombok.Value;

@Value
public class GalleryEntry {
  String displayName;
  String previewRouteKey;
  String fullRouteKey;
}
