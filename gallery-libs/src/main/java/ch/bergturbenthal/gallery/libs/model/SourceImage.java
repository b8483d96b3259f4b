package ch.bergturbenthal.gallery.libs.model;

import java.nio.file.Path;
import lombok.Value;

@Value
public class SourceImage {
  int ordinal;
  Path path;
  String filename;
  String displayName;
}
