package ch.bergturbenthal.gallery.libs.service;

import ch.bergturbenthal.gallery.libs.model.Gallery;
import java.io.IOException;
import java.nio.file.Path;

public interface GalleryBuilder {
  Gallery build(Path directory) throws IOException, InterruptedException;
}
