package com.scholary.chaptify.timecode;

/**
 * A resolved chapter: absolute start and end in milliseconds from the start of the recording.
 */
public record ChapterMarker(int index, String title, long startMs, long endMs) {

  public ChapterMarker {
    if (index < 0) {
      throw new IllegalArgumentException("Chapter index cannot be negative");
    }
    if (startMs < 0) {
      throw new IllegalArgumentException("Chapter start cannot be negative");
    }
    if (endMs <= startMs) {
      throw new IllegalArgumentException("Chapter end must be > start");
    }
  }

  public long durationMs() {
    return endMs - startMs;
  }
}
