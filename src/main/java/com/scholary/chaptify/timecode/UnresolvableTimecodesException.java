package com.scholary.chaptify.timecode;

import com.scholary.chaptify.pipeline.FailureKind;
import com.scholary.chaptify.pipeline.PipelineException;

/** Thrown when a track listing cannot be turned into a valid chapter partition. */
public class UnresolvableTimecodesException extends PipelineException {

  public UnresolvableTimecodesException(String message) {
    super(FailureKind.UNRESOLVABLE_TIMECODES, message);
  }

  public UnresolvableTimecodesException(String message, Throwable cause) {
    super(FailureKind.UNRESOLVABLE_TIMECODES, message, cause);
  }
}
