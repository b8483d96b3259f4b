package ch.bergturbenthal.gallery.libs.service.impl;

import ch.bergturbenthal.gallery.libs.model.Asset;
import ch.bergturbenthal.gallery.libs.service.ArchiveBuilder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes a zip archive into memory. Entries are stored uncompressed, JPEG data does not deflate
 * noticeably. Single writer, not thread safe.
 */
public class ZipArchiveBuilder implements ArchiveBuilder {
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final ZipOutputStream zipOutputStream = new ZipOutputStream(buffer);
  private final Set<String> names = new HashSet<>();
  private boolean finished = false;

  @Override
  public void append(final String name, final byte[] content) throws IOException {
    if (finished) {
      throw new IllegalStateException("Archive already finished, cannot append " + name);
    }
    if (!names.add(name)) {
      throw new IllegalStateException("Duplicate archive entry " + name);
    }
    final CRC32 crc = new CRC32();
    crc.update(content);
    final ZipEntry entry = new ZipEntry(name);
    entry.setMethod(ZipEntry.STORED);
    entry.setSize(content.length);
    entry.setCompressedSize(content.length);
    entry.setCrc(crc.getValue());
    zipOutputStream.putNextEntry(entry);
    zipOutputStream.write(content);
    zipOutputStream.closeEntry();
  }

  @Override
  public Asset finish() throws IOException {
    if (finished) {
      throw new IllegalStateException("Archive already finished");
    }
    finished = true;
    zipOutputStream.close();
    return new Asset(buffer.toByteArray(), Asset.APPLICATION_ZIP);
  }

  @Override
  public int getEntryCount() {
    return names.size();
  }
}
