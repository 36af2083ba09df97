package com.scholary.chaptify.catalog;

import com.scholary.chaptify.pipeline.FailureKind;
import com.scholary.chaptify.pipeline.PipelineException;

/**
 * Exception thrown when a catalog call fails.
 *
 * <p>The {@link Reason} separates conditions worth retrying from permanent ones. Only {@link
 * Reason#TRANSIENT} is retried by the pipeline.
 */
public class CatalogException extends PipelineException {

  public enum Reason {
    /** Network failure, rate limiting or a server-side error. */
    TRANSIENT,
    /** The requested work does not exist. */
    NOT_FOUND,
    /** Missing, expired or insufficient credentials. */
    UNAUTHORIZED,
    /** The catalog refused the request as invalid. */
    REJECTED,
    /** The response did not have the expected shape. */
    MALFORMED
  }

  private final Reason reason;

  public CatalogException(Reason reason, String message) {
    super(FailureKind.CATALOG, message);
    this.reason = reason;
  }

  public CatalogException(Reason reason, String message, Throwable cause) {
    super(FailureKind.CATALOG, message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isRetryable() {
    return reason == Reason.TRANSIENT;
  }

  @Override
  public String getMessage() {
    return reason + ": " + super.getMessage();
  }
}
