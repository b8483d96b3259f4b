package ch.bergturbenthal.gallery.libs;

import ch.bergturbenthal.gallery.libs.model.Gallery;
import ch.bergturbenthal.gallery.libs.properties.GalleryProperties;
import ch.bergturbenthal.gallery.libs.service.GalleryBuilder;
import ch.bergturbenthal.gallery.libs.service.impl.DefaultGalleryBuilder;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties(GalleryProperties.class)
@ComponentScan(basePackageClasses = DefaultGalleryBuilder.class)
@Slf4j
public class GalleryLibConfiguration {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService transcodeExecutor(final GalleryProperties properties) {
    final int threadCount = Math.max(1, properties.getWorkerThreads());
    final CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("transcode-");
    threadFactory.setDaemon(true);
    final ThreadPoolExecutor executor =
        new ThreadPoolExecutor(
            threadCount,
            threadCount,
            Duration.ofMinutes(1).toMillis(),
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            threadFactory);
    // the pool is only busy while the gallery is built
    executor.allowCoreThreadTimeOut(true);
    log.info("Transcoding with {} threads", threadCount);
    return executor;
  }

  @Bean
  public Gallery gallery(final GalleryBuilder galleryBuilder, final GalleryProperties properties)
      throws IOException, InterruptedException {
    return galleryBuilder.build(properties.getDirectory().toPath());
  }
}
