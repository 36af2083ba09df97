package com.scholary.chaptify.pipeline;

import java.nio.file.Path;

/**
 * One file to chapterize.
 *
 * @param source the audiobook container
 * @param destination where the chaptered file is written; equal to {@code source} for in-place
 * @param dryRun resolve chapters and build the control file, but do not remux
 */
public record ChapterizationRequest(Path source, Path destination, boolean dryRun) {

  public static ChapterizationRequest inPlace(Path source) {
    return new ChapterizationRequest(source, source, false);
  }
}
