package ch.bergturbenthal.gallery.libs.service;

import ch.bergturbenthal.gallery.libs.model.SourceImage;
import ch.bergturbenthal.gallery.libs.model.TranscodeResult;
import java.util.List;
import java.util.concurrent.BlockingQueue;

public interface WorkerPool {
  /**
   * Schedules one transcode per source and returns immediately. Exactly one result per source is
   * put into {@code completions}, in whatever order the workers finish.
   */
  void transcodeAll(List<SourceImage> sources, BlockingQueue<TranscodeResult> completions);
}
