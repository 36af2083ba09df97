package com.scholary.chaptify.timecode;

import com.scholary.chaptify.catalog.CatalogTrack;
import com.scholary.chaptify.config.ChapterProperties;
import com.scholary.chaptify.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns nominal catalog track lengths into absolute chapter timecodes for the actual file.
 *
 * <p>Catalog lengths and the encoded file rarely agree to the millisecond (different masters,
 * trimmed silence), so each track is rescaled proportionally:
 *
 * <pre>
 * resolved[i] = round(nominal[i] * actualDuration / nominalTotal)
 * </pre>
 *
 * <p>The rounding residual goes entirely to the last chapter, so the chapters partition {@code [0,
 * actualDuration]} exactly. Rescaling is refused when the two totals drift apart by more than the
 * configured tolerance.
 */
@Component
public class TimecodeResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimecodeResolver.class);

  private final double driftTolerance;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public TimecodeResolver(ChapterProperties properties) {
    this.driftTolerance = properties.driftTolerance();
  }

  /**
   * Resolve chapter markers.
   *
   * @param tracks the catalog tracks in chapter order
   * @param actualDurationMs the measured duration of the file
   * @return markers covering exactly {@code [0, actualDurationMs]}
   * @throws UnresolvableTimecodesException if there are no tracks, they sum to zero, or a chapter
   *     would end up empty
   * @throws DurationMismatchException if the totals drift apart beyond the tolerance
   */
  public List<ChapterMarker> resolve(List<CatalogTrack> tracks, long actualDurationMs) {
    if (actualDurationMs <= 0) {
      throw new IllegalArgumentException("Actual duration must be positive");
    }
    if (tracks.isEmpty()) {
      throw new UnresolvableTimecodesException("Catalog returned no tracks");
    }

    long nominalTotalMs = 0;
    for (CatalogTrack track : tracks) {
      nominalTotalMs += track.nominalDurationMs();
    }
    if (nominalTotalMs == 0) {
      throw new UnresolvableTimecodesException(
          String.format("All %d catalog tracks have zero duration", tracks.size()));
    }

    double drift = Math.abs(actualDurationMs - nominalTotalMs) / (double) nominalTotalMs;
    if (drift > driftTolerance) {
      throw new DurationMismatchException(
          String.format(
              "Catalog total %d ms and file duration %d ms differ by %.1f%% (tolerance %.1f%%)",
              nominalTotalMs, actualDurationMs, drift * 100, driftTolerance * 100),
          nominalTotalMs,
          actualDurationMs);
    }

    long[] resolved = new long[tracks.size()];
    long resolvedTotal = 0;
    for (int i = 0; i < tracks.size(); i++) {
      resolved[i] = scale(tracks.get(i).nominalDurationMs(), actualDurationMs, nominalTotalMs);
      resolvedTotal += resolved[i];
    }
    long residual = actualDurationMs - resolvedTotal;
    resolved[resolved.length - 1] += residual;

    List<ChapterMarker> markers = new ArrayList<>(tracks.size());
    long start = 0;
    for (int i = 0; i < tracks.size(); i++) {
      CatalogTrack track = tracks.get(i);
      if (resolved[i] <= 0) {
        throw new UnresolvableTimecodesException(
            String.format(
                "Track %d ('%s', %d ms nominal) resolves to an empty chapter",
                track.index(), track.name(), track.nominalDurationMs()));
      }
      long end = start + resolved[i];
      markers.add(new ChapterMarker(i, titleOf(track), start, end));
      start = end;
    }

    structuredLogger.logChaptersResolved(
        markers.size(), nominalTotalMs, actualDurationMs, drift, residual);
    return markers;
  }

  /** {@code round(nominal * actual / total)}, half-up, in exact integer arithmetic. */
  private static long scale(long nominalMs, long actualMs, long totalMs) {
    try {
      long numerator = Math.multiplyExact(Math.multiplyExact(2L, nominalMs), actualMs);
      return Math.addExact(numerator, totalMs) / Math.multiplyExact(2L, totalMs);
    } catch (ArithmeticException e) {
      throw new UnresolvableTimecodesException("Track durations too large to rescale", e);
    }
  }

  private static String titleOf(CatalogTrack track) {
    String name = track.name().trim();
    return name.isEmpty() ? "Chapter " + (track.index() + 1) : name;
  }
}
