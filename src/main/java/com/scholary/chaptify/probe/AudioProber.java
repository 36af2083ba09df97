package com.scholary.chaptify.probe;

import java.nio.file.Path;

/** Measures the real duration of an audio container. */
public interface AudioProber {

  /**
   * Probe a file.
   *
   * @param file the container to inspect
   * @return its measured duration
   * @throws AudioProbeException if the duration cannot be determined
   */
  AudioProbe probe(Path file);
}
