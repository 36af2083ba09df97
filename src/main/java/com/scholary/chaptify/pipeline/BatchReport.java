package com.scholary.chaptify.pipeline;

import java.util.List;

/** Outcomes of a batch run, in submission order. */
public record BatchReport(List<FileOutcome> outcomes) {

  public BatchReport {
    outcomes = List.copyOf(outcomes);
  }

  public long succeeded() {
    return outcomes.stream().filter(FileOutcome::succeeded).count();
  }

  public long failed() {
    return outcomes.size() - succeeded();
  }

  public boolean allSucceeded() {
    return failed() == 0;
  }
}
