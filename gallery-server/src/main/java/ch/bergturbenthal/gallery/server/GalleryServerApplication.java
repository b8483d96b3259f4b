package ch.bergturbenthal.gallery.server;

import ch.bergturbenthal.gallery.libs.GalleryLibConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(GalleryLibConfiguration.class)
public class GalleryServerApplication {

  public static void main(String[] args) {
    SpringApplication.run(GalleryServerApplication.class, args);
  }
}
