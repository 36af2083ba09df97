package com.scholary.chaptify.matching;

import com.scholary.chaptify.catalog.WorkSummary;
import com.scholary.chaptify.pipeline.FailureKind;
import com.scholary.chaptify.pipeline.PipelineException;
import java.util.List;

/** Thrown when no catalog candidate survives author and title matching. */
public class NoMatchException extends PipelineException {

  private final List<WorkSummary> candidates;

  public NoMatchException(String message, List<WorkSummary> candidates) {
    super(FailureKind.NO_MATCH, message);
    this.candidates = List.copyOf(candidates);
  }

  /** Everything the catalog returned, for diagnosis. */
  public List<WorkSummary> candidates() {
    return candidates;
  }
}
