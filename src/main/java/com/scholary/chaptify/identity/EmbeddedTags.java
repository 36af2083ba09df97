package com.scholary.chaptify.identity;

/**
 * Author and title as found in a file's own tag metadata. Either field may be null or blank.
 */
public record EmbeddedTags(String author, String title) {

  /** True when both fields survive normalization. */
  public boolean isComplete() {
    return !NameNormalizer.normalize(author).isEmpty() && !NameNormalizer.normalize(title).isEmpty();
  }
}
