package com.scholary.chaptify.remux;

import com.scholary.chaptify.pipeline.FailureKind;
import com.scholary.chaptify.pipeline.PipelineException;

/**
 * Exception thrown when embedding chapters fails. The original file is untouched whenever this is
 * thrown.
 */
public class RemuxException extends PipelineException {

  public enum Reason {
    TIMEOUT,
    NON_ZERO_EXIT,
    INVALID_OUTPUT,
    IO
  }

  private final Reason reason;

  public RemuxException(Reason reason, String message) {
    super(FailureKind.REMUX, message);
    this.reason = reason;
  }

  public RemuxException(Reason reason, String message, Throwable cause) {
    super(FailureKind.REMUX, message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  @Override
  public String getMessage() {
    return reason + ": " + super.getMessage();
  }
}
