package ch.bergturbenthal.gallery.libs.service.impl;

import ch.bergturbenthal.gallery.libs.model.SourceImage;
import ch.bergturbenthal.gallery.libs.model.TranscodeResult;
import ch.bergturbenthal.gallery.libs.service.TranscodeWorker;
import ch.bergturbenthal.gallery.libs.service.WorkerPool;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ExecutorWorkerPool implements WorkerPool {
  private final ExecutorService executorService;
  private final TranscodeWorker transcodeWorker;

  public ExecutorWorkerPool(
      @Qualifier("transcodeExecutor") final ExecutorService executorService,
      final TranscodeWorker transcodeWorker) {
    this.executorService = executorService;
    this.transcodeWorker = transcodeWorker;
  }

  @Override
  public void transcodeAll(
      final List<SourceImage> sources, final BlockingQueue<TranscodeResult> completions) {
    for (SourceImage source : sources) {
      executorService.execute(() -> runWorker(source, completions));
    }
  }

  private void runWorker(
      final SourceImage source, final BlockingQueue<TranscodeResult> completions) {
    final TranscodeResult result;
    try {
      result = transcodeWorker.transcode(source);
    } catch (RuntimeException | Error e) {
      log.error("Transcoder crashed on {}", source.getPath(), e);
      // the aggregator waits for exactly one result per source
      completions.add(TranscodeResult.failure(source, "Transcoder crashed: " + e));
      if (e instanceof VirtualMachineError) throw (VirtualMachineError) e;
      return;
    }
    completions.add(result);
  }
}
