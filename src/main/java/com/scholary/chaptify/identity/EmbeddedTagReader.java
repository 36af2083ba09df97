package com.scholary.chaptify.identity;

import java.nio.file.Path;
import java.util.Optional;

/** Reads the author/title tags embedded in an audio container. */
public interface EmbeddedTagReader {

  /**
   * Read the embedded author and title.
   *
   * @param file the audio file
   * @return the tags, or empty if the file carries none or they cannot be read
   */
  Optional<EmbeddedTags> read(Path file);
}
