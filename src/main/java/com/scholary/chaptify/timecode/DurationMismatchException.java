package com.scholary.chaptify.timecode;

import com.scholary.chaptify.pipeline.FailureKind;
import com.scholary.chaptify.pipeline.PipelineException;

/**
 * Thrown when the catalog's total duration and the file's measured duration differ by more than
 * the configured tolerance. This usually means the matched work is a different edition.
 */
public class DurationMismatchException extends PipelineException {

  private final long nominalTotalMs;
  private final long actualDurationMs;

  public DurationMismatchException(String message, long nominalTotalMs, long actualDurationMs) {
    super(FailureKind.DURATION_MISMATCH, message);
    this.nominalTotalMs = nominalTotalMs;
    this.actualDurationMs = actualDurationMs;
  }

  public long nominalTotalMs() {
    return nominalTotalMs;
  }

  public long actualDurationMs() {
    return actualDurationMs;
  }
}
