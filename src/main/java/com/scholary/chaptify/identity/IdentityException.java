package com.scholary.chaptify.identity;

import com.scholary.chaptify.pipeline.FailureKind;
import com.scholary.chaptify.pipeline.PipelineException;

/** Thrown when no usable author/title pair can be derived for a file. */
public class IdentityException extends PipelineException {

  public IdentityException(String message) {
    super(FailureKind.IDENTITY, message);
  }
}
