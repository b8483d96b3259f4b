package ch.bergturbenthal.gallery.libs.service.impl;

import ch.bergturbenthal.gallery.libs.model.SourceImage;
import ch.bergturbenthal.gallery.libs.properties.GalleryProperties;
import ch.bergturbenthal.gallery.libs.service.DirectoryScanner;
import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DefaultDirectoryScanner implements DirectoryScanner {
  private final Set<String> extensions;
  private final boolean ignoreExtensionCase;
  private final boolean sortByName;

  public DefaultDirectoryScanner(final GalleryProperties properties) {
    ignoreExtensionCase = properties.isIgnoreExtensionCase();
    sortByName = properties.isSortByName();
    extensions =
        properties.getExtensions().stream()
            .map(e -> ignoreExtensionCase ? e.toLowerCase(Locale.ROOT) : e)
            .collect(Collectors.toUnmodifiableSet());
  }

  @Override
  public List<SourceImage> scan(final Path directory) throws IOException {
    final List<Path> candidates = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        if (isCandidate(entry)) candidates.add(entry);
      }
    } catch (DirectoryIteratorException e) {
      throw new IOException("Cannot list " + directory, e.getCause());
    }
    if (sortByName) {
      candidates.sort(Comparator.comparing(p -> p.getFileName().toString()));
    }

    final List<SourceImage> images = new ArrayList<>(candidates.size());
    for (Path path : candidates) {
      final String filename = path.getFileName().toString();
      images.add(
          new SourceImage(images.size(), path, filename, FilenameUtils.getBaseName(filename)));
    }
    log.debug("Scanned {}: {} candidates", directory, images.size());
    return images;
  }

  private boolean isCandidate(final Path entry) {
    final String extension = FilenameUtils.getExtension(entry.getFileName().toString());
    if (!extensions.contains(ignoreExtensionCase ? extension.toLowerCase(Locale.ROOT) : extension))
      return false;
    try {
      return Files.readAttributes(entry, BasicFileAttributes.class).isRegularFile();
    } catch (IOException e) {
      log.warn("Cannot read attributes of {}, skipping", entry, e);
      return false;
    }
  }
}
