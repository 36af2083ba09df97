package com.scholary.chaptify.probe;

import com.scholary.chaptify.pipeline.FailureKind;
import com.scholary.chaptify.pipeline.PipelineException;

/** Thrown when a file's duration cannot be measured. */
public class AudioProbeException extends PipelineException {

  public AudioProbeException(String message) {
    super(FailureKind.PROBE, message);
  }

  public AudioProbeException(String message, Throwable cause) {
    super(FailureKind.PROBE, message, cause);
  }
}
