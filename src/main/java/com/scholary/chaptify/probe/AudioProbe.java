package com.scholary.chaptify.probe;

import java.nio.file.Path;

/** Measured facts about an audio file, independent of any catalog. */
public record AudioProbe(Path file, long actualDurationMs) {

  public AudioProbe {
    if (actualDurationMs <= 0) {
      throw new IllegalArgumentException("Duration must be positive");
    }
  }
}
