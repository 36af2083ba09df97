package com.scholary.chaptify.identity;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embedded tag reader backed by jaudiotagger.
 *
 * <p>Audiobook rippers disagree on where the author and book title go, so ARTIST falls back to
 * ALBUM_ARTIST and TITLE falls back to ALBUM.
 */
@Component
public class JaudiotaggerTagReader implements EmbeddedTagReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(JaudiotaggerTagReader.class);

  static {
    // jaudiotagger logs every atom it parses through java.util.logging
    java.util.logging.Logger.getLogger("org.jaudiotagger").setLevel(Level.OFF);
  }

  @Override
  public Optional<EmbeddedTags> read(Path file) {
    try {
      AudioFile audioFile = AudioFileIO.read(file.toFile());
      Tag tag = audioFile.getTag();
      if (tag == null) {
        LOGGER.debug("No embedded tags in {}", file.getFileName());
        return Optional.empty();
      }

      String author = firstNonBlank(tag, FieldKey.ARTIST, FieldKey.ALBUM_ARTIST);
      String title = firstNonBlank(tag, FieldKey.TITLE, FieldKey.ALBUM);
      LOGGER.debug("Embedded tags in {}: author='{}', title='{}'", file.getFileName(), author, title);
      return Optional.of(new EmbeddedTags(author, title));

    } catch (Exception e) {
      // Tags are optional; the file name is still a usable source
      LOGGER.warn("Could not read embedded tags from {}: {}", file.getFileName(), e.getMessage());
      return Optional.empty();
    }
  }

  private static String firstNonBlank(Tag tag, FieldKey... keys) {
    for (FieldKey key : keys) {
      String value = tag.getFirst(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
