package ch.bergturbenthal.gallery.server.interfaces;

import ch.bergturbenthal.gallery.libs.model.Asset;
import ch.bergturbenthal.gallery.libs.model.Gallery;
import ch.bergturbenthal.gallery.libs.model.GalleryEntry;
import ch.bergturbenthal.gallery.libs.model.RouteKeys;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.ResponseBody;

@Slf4j
@Controller
public class GalleryController {
  public static final ResponseEntity<Resource> NOT_FOUND_RESPONSE =
      new ResponseEntity<>(HttpStatus.NOT_FOUND);
  private final Gallery gallery;
  private final MeterRegistry meterRegistry;

  public GalleryController(final Gallery gallery, final MeterRegistry meterRegistry) {
    this.gallery = gallery;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("gallery.images", gallery.getEntries(), List::size);
  }

  @GetMapping("/")
  public String index() {
    return "forward:/index.html";
  }

  @GetMapping("/index.json")
  public @ResponseBody GalleryIndex galleryIndex() {
    return new GalleryIndex(gallery.getEntries(), gallery.getArchiveRouteKey());
  }

  @GetMapping("/{filename:(?i).+\\.jpe?g}")
  public @ResponseBody ResponseEntity<Resource> takeOriginal(
      @PathVariable("filename") String filename) {
    return serve("original", RouteKeys.fullImage(filename), false);
  }

  @GetMapping("/preview/{name:.+}")
  public @ResponseBody ResponseEntity<Resource> takePreview(@PathVariable("name") String name) {
    return serve("preview", RouteKeys.PREVIEW_PREFIX + name, false);
  }

  @GetMapping("/{archive:.+\\.zip}")
  public @ResponseBody ResponseEntity<Resource> takeArchive(
      @PathVariable("archive") String archive) {
    return serve("archive", RouteKeys.archive(archive), true);
  }

  @NotNull
  private ResponseEntity<Resource> serve(
      final String kind, final String routeKey, final boolean attachment) {
    final Optional<Asset> found = gallery.find(routeKey);
    meterRegistry
        .counter("gallery.download", "kind", kind, "result", found.isPresent() ? "ok" : "missing")
        .increment();
    if (found.isEmpty()) {
      log.debug("No asset at {}", routeKey);
      return NOT_FOUND_RESPONSE;
    }
    final AssetResource resource = new AssetResource(found.get(), routeKey);
    final HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.parseMediaType(found.get().getContentType()));
    headers.setCacheControl(CacheControl.maxAge(1, TimeUnit.DAYS));
    if (attachment) {
      headers.setContentDisposition(
          ContentDisposition.attachment().filename(resource.getFilename()).build());
    }
    return new ResponseEntity<>(resource, headers, HttpStatus.OK);
  }

  @Value
  public static class GalleryIndex {
    List<GalleryEntry> entries;
    String archiveRouteKey;
  }
}
