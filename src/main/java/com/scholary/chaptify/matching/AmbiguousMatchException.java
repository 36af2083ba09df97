package com.scholary.chaptify.matching;

import com.scholary.chaptify.catalog.WorkSummary;
import com.scholary.chaptify.pipeline.FailureKind;
import com.scholary.chaptify.pipeline.PipelineException;
import java.util.List;

/**
 * Thrown when several candidates remain equally good after every tie-break. Picking one of them
 * would risk tagging the file with another edition's chapters.
 */
public class AmbiguousMatchException extends PipelineException {

  private final List<WorkSummary> candidates;

  public AmbiguousMatchException(String message, List<WorkSummary> candidates) {
    super(FailureKind.AMBIGUOUS_MATCH, message);
    this.candidates = List.copyOf(candidates);
  }

  /** The candidates that could not be told apart. */
  public List<WorkSummary> candidates() {
    return candidates;
  }
}
