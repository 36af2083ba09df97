package com.scholary.chaptify.pipeline;

import com.scholary.chaptify.catalog.CatalogWork;
import com.scholary.chaptify.timecode.ChapterMarker;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a successful run. {@code output} is null for a dry run.
 */
public record ChapterizationResult(
    Path source,
    Path output,
    CatalogWork work,
    List<ChapterMarker> chapters,
    String controlFile,
    boolean dryRun) {

  public ChapterizationResult {
    chapters = List.copyOf(chapters);
  }
}
