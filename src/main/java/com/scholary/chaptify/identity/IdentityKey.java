package com.scholary.chaptify.identity;

/**
 * The normalized (author, title) pair used to look a recording up in the catalog.
 *
 * <p>Both fields are normalized on construction; a pair that normalizes to an empty author or title
 * is rejected with an {@link IdentityException}.
 */
public record IdentityKey(String author, String title) {

  public IdentityKey {
    author = NameNormalizer.normalize(author);
    title = NameNormalizer.normalize(title);
    if (author.isEmpty()) {
      throw new IdentityException("Author is empty after normalization");
    }
    if (title.isEmpty()) {
      throw new IdentityException("Title is empty after normalization");
    }
  }
}
