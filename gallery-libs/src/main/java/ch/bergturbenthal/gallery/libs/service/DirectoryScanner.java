package ch.bergturbenthal.gallery.libs.service;

import ch.bergturbenthal.gallery.libs.model.SourceImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface DirectoryScanner {
  /**
   * Lists the JPEG candidates of {@code directory}. Ordinals of the returned images are 0..n-1 in
   * list order.
   *
   * @throws IOException if the directory itself cannot be listed
   */
  List<SourceImage> scan(Path directory) throws IOException;
}
