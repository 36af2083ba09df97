package com.scholary.chaptify.matching;

import com.scholary.chaptify.catalog.CatalogTrack;
import com.scholary.chaptify.catalog.WorkSummary;
import com.scholary.chaptify.identity.IdentityKey;
import com.scholary.chaptify.identity.NameNormalizer;
import com.scholary.chaptify.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Selects the one catalog work that corresponds to an identity key.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Drop every candidate whose author does not match the query author. Name order is ignored,
 *       so "Jones, Diana Wynne" matches "Diana Wynne Jones".
 *   <li>Score titles: an exact normalized match scores {@value #EXACT_TITLE}, a whole-word
 *       containment in either direction (subtitles, series prefixes) scores {@value
 *       #PARTIAL_TITLE}, anything else is dropped.
 *   <li>Keep the best-scoring group. If it has one member, that is the match.
 *   <li>With a duration hint, prefer the candidate whose nominal total duration is closest to it.
 *       Without a hint, provider order decides.
 *   <li>If the duration tie-break still leaves several candidates, fail as ambiguous.
 * </ol>
 */
@Component
public class WorkMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkMatcher.class);

  static final int EXACT_TITLE = 2;
  static final int PARTIAL_TITLE = 1;

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Match a query against catalog candidates.
   *
   * @param query the normalized identity
   * @param candidates search results in provider order
   * @param durationHintMs the recording's known duration, if any
   * @param trackLoader loads track listings for the duration tie-break
   * @return the selected candidate
   * @throws NoMatchException if no candidate passes the author and title filters
   * @throws AmbiguousMatchException if the tie-breaks cannot separate the best candidates
   */
  public WorkSummary match(
      IdentityKey query,
      List<WorkSummary> candidates,
      OptionalLong durationHintMs,
      TrackLoader trackLoader) {

    List<WorkSummary> byAuthor =
        candidates.stream().filter(candidate -> authorMatches(query.author(), candidate)).toList();
    if (byAuthor.isEmpty()) {
      throw new NoMatchException(
          String.format(
              "None of %d candidates is by '%s' (%s)",
              candidates.size(), query.author(), describe(candidates)),
          candidates);
    }

    int bestScore = 0;
    List<WorkSummary> best = new ArrayList<>();
    for (WorkSummary candidate : byAuthor) {
      int score = titleScore(query.title(), candidate.title());
      if (score == 0 || score < bestScore) {
        continue;
      }
      if (score > bestScore) {
        bestScore = score;
        best.clear();
      }
      best.add(candidate);
    }

    if (best.isEmpty()) {
      throw new NoMatchException(
          String.format(
              "No candidate by '%s' is titled '%s' (%s)",
              query.author(), query.title(), describe(byAuthor)),
          candidates);
    }

    if (best.size() == 1) {
      return selected(best.get(0), bestScore, candidates.size(), "unique");
    }

    if (durationHintMs.isEmpty()) {
      LOGGER.info(
          "{} candidates tie on title and no duration hint is available, using provider order",
          best.size());
      return selected(best.get(0), bestScore, candidates.size(), "provider_order");
    }

    List<WorkSummary> closest = closestByDuration(best, durationHintMs.getAsLong(), trackLoader);
    if (closest.size() > 1) {
      throw new AmbiguousMatchException(
          String.format(
              "%d candidates for '%s' by '%s' are equally close to %d ms (%s)",
              closest.size(), query.title(), query.author(), durationHintMs.getAsLong(),
              describe(closest)),
          closest);
    }
    return selected(closest.get(0), bestScore, candidates.size(), "duration");
  }

  static boolean authorMatches(String queryAuthor, WorkSummary candidate) {
    if (NameNormalizer.sameName(queryAuthor, candidate.author())) {
      return true;
    }
    return candidate.authors().stream().anyMatch(author -> NameNormalizer.sameName(queryAuthor, author));
  }

  static int titleScore(String queryTitle, String candidateTitle) {
    String title = NameNormalizer.normalize(candidateTitle);
    if (title.isEmpty()) {
      return 0;
    }
    if (title.equals(queryTitle)) {
      return EXACT_TITLE;
    }
    String paddedTitle = " " + title + " ";
    String paddedQuery = " " + queryTitle + " ";
    if (paddedTitle.contains(paddedQuery) || paddedQuery.contains(paddedTitle)) {
      return PARTIAL_TITLE;
    }
    return 0;
  }

  private List<WorkSummary> closestByDuration(
      List<WorkSummary> tied, long hintMs, TrackLoader trackLoader) {
    long bestDistance = Long.MAX_VALUE;
    List<WorkSummary> closest = new ArrayList<>();

    for (WorkSummary candidate : tied) {
      long total = trackLoader.load(candidate.id()).stream()
          .mapToLong(CatalogTrack::nominalDurationMs)
          .sum();
      long distance = Math.abs(total - hintMs);
      LOGGER.debug("Candidate {} nominal total {} ms, distance {} ms", candidate.id(), total, distance);

      if (distance < bestDistance) {
        bestDistance = distance;
        closest.clear();
      }
      if (distance == bestDistance) {
        closest.add(candidate);
      }
    }
    return closest;
  }

  private WorkSummary selected(WorkSummary work, int score, int candidateCount, String decidedBy) {
    structuredLogger.logWorkMatched(work.id(), work.title(), score, candidateCount, decidedBy);
    return work;
  }

  private static String describe(List<WorkSummary> candidates) {
    return candidates.stream()
        .map(c -> String.format("%s: '%s' by '%s'", c.id(), c.title(), c.author()))
        .collect(Collectors.joining("; "));
  }
}
