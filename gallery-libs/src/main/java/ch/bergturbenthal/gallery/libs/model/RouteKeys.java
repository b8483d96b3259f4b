package ch.bergturbenthal.gallery.libs.model;

public class RouteKeys {
  public static final String PREVIEW_PREFIX = "/preview/";
  public static final String PREVIEW_SUFFIX = ".jpg";

  private RouteKeys() {}

  public static String fullImage(final String filename) {
    return "/" + filename;
  }

  public static String preview(final String displayName) {
    return PREVIEW_PREFIX + displayName + PREVIEW_SUFFIX;
  }

  public static String archive(final String archiveName) {
    return "/" + archiveName;
  }
}
