package com.scholary.chaptify.pipeline;

/**
 * Base class for every failure raised while chapterizing a file.
 *
 * <p>Each component throws its own subclass. The pipeline never wraps or downgrades them, so the
 * caller always sees the failure exactly as the failing component reported it.
 */
public abstract class PipelineException extends RuntimeException {

  private final FailureKind kind;

  protected PipelineException(FailureKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected PipelineException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public FailureKind kind() {
    return kind;
  }
}
