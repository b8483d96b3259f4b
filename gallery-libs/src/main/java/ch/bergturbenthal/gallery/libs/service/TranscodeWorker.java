package ch.bergturbenthal.gallery.libs.service;

import ch.bergturbenthal.gallery.libs.model.SourceImage;
import ch.bergturbenthal.gallery.libs.model.TranscodeResult;

public interface TranscodeWorker {
  /** Never throws for a broken input file, a failure is reported in the returned result. */
  TranscodeResult transcode(SourceImage source);
}
