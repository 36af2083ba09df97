package com.scholary.chaptify.identity;

import com.scholary.chaptify.logging.StructuredLogger;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives the catalog lookup key for an audio file.
 *
 * <p>Complete embedded tags win. Otherwise the file name must follow {@code "<author> - <title>.<ext>"},
 * optionally prefixed by a bracketed group such as {@code "[Unabridged] "}. Only the first {@code " -
 * "} separates author from title, so titles like {@code "Dune - Part One"} survive intact.
 */
@Component
public class IdentityExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(IdentityExtractor.class);

  // Lazy author group: the first " - " is the separator
  private static final Pattern FILE_NAME_PATTERN =
      Pattern.compile("^(?:\\[[^\\]]*\\]\\s+)?(?<author>.+?) - (?<title>.+)$");

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Extract the identity key for a file.
   *
   * @param file the audio file
   * @param tags embedded tags, if any were read
   * @return the normalized key
   * @throws IdentityException if neither the tags nor the file name yield an author and title
   */
  public IdentityKey extract(Path file, Optional<EmbeddedTags> tags) {
    if (tags.isPresent() && tags.get().isComplete()) {
      IdentityKey key = new IdentityKey(tags.get().author(), tags.get().title());
      structuredLogger.logIdentityResolved(IdentitySource.TAGS, key.author(), key.title());
      return key;
    }

    IdentityKey key = fromFileName(file);
    structuredLogger.logIdentityResolved(IdentitySource.FILENAME, key.author(), key.title());
    return key;
  }

  IdentityKey fromFileName(Path file) {
    Path fileName = file.getFileName();
    if (fileName == null) {
      throw new IdentityException("Path has no file name: " + file);
    }

    String stem = stripExtension(fileName.toString());
    Matcher matcher = FILE_NAME_PATTERN.matcher(stem);
    if (!matcher.matches()) {
      throw new IdentityException(
          String.format(
              "No usable tags and file name '%s' does not match '<author> - <title>.<ext>'",
              fileName));
    }

    String author = matcher.group("author");
    String title = matcher.group("title");
    if (NameNormalizer.normalize(author).isEmpty() || NameNormalizer.normalize(title).isEmpty()) {
      throw new IdentityException(
          String.format("File name '%s' has an empty author or title", fileName));
    }
    return new IdentityKey(author, title);
  }

  private static String stripExtension(String name) {
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
