package ch.bergturbenthal.gallery.libs.properties;

import java.io.File;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "gallery")
@Data
public class GalleryProperties {
  private File directory = new File(".");
  private int workerThreads = Runtime.getRuntime().availableProcessors();
  // 0..100, mapped onto the encoder's compression quality
  private int previewQuality = 50;
  private int previewMaxWidth = 900;
  private int previewMaxHeight = 600;
  // larger sources are skipped; they are held in memory as a single array
  private DataSize maxImageSize = DataSize.ofMegabytes(512);
  private Set<String> extensions = new LinkedHashSet<>(List.of("jpg", "jpeg"));
  private boolean ignoreExtensionCase = true;
  private boolean sortByName = false;
  private String archiveName = "gallery.zip";
}
