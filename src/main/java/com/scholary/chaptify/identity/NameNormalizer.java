package com.scholary.chaptify.identity;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for author and title strings.
 *
 * <p>Normalization folds case, strips diacritics, removes apostrophes ("Howl's" becomes "howls"),
 * turns every other run of punctuation or whitespace into a single space and trims the result.
 */
public final class NameNormalizer {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
  private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

  private NameNormalizer() {}

  public static String normalize(String value) {
    if (value == null) {
      return "";
    }
    String folded = Normalizer.normalize(value, Normalizer.Form.NFKD);
    folded = COMBINING_MARKS.matcher(folded).replaceAll("");
    folded = folded.toLowerCase(Locale.ROOT);
    folded = APOSTROPHES.matcher(folded).replaceAll("");
    return SEPARATORS.matcher(folded).replaceAll(" ").trim();
  }

  /** Normalized tokens of a person's name, sorted so that name order does not matter. */
  public static List<String> nameTokens(String name) {
    String normalized = normalize(name);
    if (normalized.isEmpty()) {
      return List.of();
    }
    String[] tokens = normalized.split(" ");
    Arrays.sort(tokens);
    return List.of(tokens);
  }

  /**
   * Whether two person names refer to the same name, allowing for "First Last" versus "Last,
   * First".
   */
  public static boolean sameName(String left, String right) {
    List<String> leftTokens = nameTokens(left);
    return !leftTokens.isEmpty() && leftTokens.equals(nameTokens(right));
  }
}
