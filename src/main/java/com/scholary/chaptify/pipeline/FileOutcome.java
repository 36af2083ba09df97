package com.scholary.chaptify.pipeline;

import java.nio.file.Path;

/**
 * Per-file entry of a batch report. Exactly one of {@code result} and {@code failureMessage} is
 * set; {@code failureKind} is null for a success or for an unexpected error outside the pipeline's
 * failure taxonomy.
 */
public record FileOutcome(
    Path source, ChapterizationResult result, FailureKind failureKind, String failureMessage) {

  public static FileOutcome success(ChapterizationResult result) {
    return new FileOutcome(result.source(), result, null, null);
  }

  public static FileOutcome failure(Path source, PipelineException failure) {
    return new FileOutcome(source, null, failure.kind(), failure.getMessage());
  }

  public static FileOutcome unexpected(Path source, RuntimeException failure) {
    return new FileOutcome(source, null, null, failure.toString());
  }

  public boolean succeeded() {
    return result != null;
  }
}
