package ch.bergturbenthal.gallery.libs.service;

import ch.bergturbenthal.gallery.libs.model.Asset;
import java.io.IOException;

public interface ArchiveBuilder {
  void append(String name, byte[] content) throws IOException;

  /** Closes the archive; the returned asset owns the archive bytes. */
  Asset finish() throws IOException;

  int getEntryCount();
}
