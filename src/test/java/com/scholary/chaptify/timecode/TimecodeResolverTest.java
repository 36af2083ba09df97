package com.scholary.chaptify.timecode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.chaptify.catalog.CatalogTrack;
import com.scholary.chaptify.config.ChapterProperties;
import com.scholary.chaptify.pipeline.FailureKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimecodeResolverTest {

  private TimecodeResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new TimecodeResolver(new ChapterProperties(0.15, 2, 100));
  }

  @Test
  void resolve_shouldKeepDurationsWhenTotalsAgree() {
    List<ChapterMarker> markers =
        resolver.resolve(tracks(600_000L, 900_000L, 300_000L), 1_800_000L);

    assertThat(markers)
        .extracting(ChapterMarker::startMs)
        .containsExactly(0L, 600_000L, 1_500_000L);
    assertThat(markers)
        .extracting(ChapterMarker::endMs)
        .containsExactly(600_000L, 1_500_000L, 1_800_000L);
  }

  @Test
  void resolve_shouldRescaleProportionally() {
    // Catalog says 1,000,000 ms, file is 1,100,000 ms: every chapter stretches by 10%
    List<ChapterMarker> markers =
        resolver.resolve(tracks(250_000L, 500_000L, 250_000L), 1_100_000L);

    assertThat(markers)
        .extracting(ChapterMarker::durationMs)
        .containsExactly(275_000L, 550_000L, 275_000L);
  }

  @Test
  void resolve_shouldGiveRoundingResidualToLastChapter() {
    // 1,000 * 3,001 / 3,000 rounds to 1,000; the last chapter absorbs the extra millisecond
    List<ChapterMarker> markers = resolver.resolve(tracks(1_000L, 1_000L, 1_000L), 3_001L);

    assertThat(markers)
        .extracting(ChapterMarker::durationMs)
        .containsExactly(1_000L, 1_000L, 1_001L);
  }

  @Test
  void resolve_shouldPartitionActualDurationExactly() {
    Random random = new Random(42);
    for (int run = 0; run < 200; run++) {
      int count = 1 + random.nextInt(60);
      long[] durations = new long[count];
      long total = 0;
      for (int i = 0; i < count; i++) {
        durations[i] = 60_000L + random.nextInt(3_600_000);
        total += durations[i];
      }
      long actual = total + (long) ((random.nextDouble() - 0.5) * 0.2 * total);

      List<ChapterMarker> markers = resolver.resolve(tracks(durations), actual);

      assertThat(markers).hasSize(count);
      assertThat(markers.get(0).startMs()).isZero();
      assertThat(markers.get(count - 1).endMs()).isEqualTo(actual);
      for (int i = 0; i < count; i++) {
        ChapterMarker marker = markers.get(i);
        assertThat(marker.index()).isEqualTo(i);
        assertThat(marker.endMs()).isGreaterThan(marker.startMs());
        if (i > 0) {
          assertThat(marker.startMs()).isEqualTo(markers.get(i - 1).endMs());
        }
        if (i < count - 1) {
          double exact = (double) durations[i] * actual / total;
          assertThat(Math.abs(marker.durationMs() - exact)).isLessThanOrEqualTo(1.0);
        }
      }
    }
  }

  @Test
  void resolve_shouldRejectLargeDrift() {
    assertThatThrownBy(() -> resolver.resolve(tracks(600_000L, 400_000L), 10_000_000L))
        .isInstanceOf(DurationMismatchException.class)
        .satisfies(
            e -> {
              DurationMismatchException failure = (DurationMismatchException) e;
              assertThat(failure.kind()).isEqualTo(FailureKind.DURATION_MISMATCH);
              assertThat(failure.nominalTotalMs()).isEqualTo(1_000_000L);
              assertThat(failure.actualDurationMs()).isEqualTo(10_000_000L);
            });
  }

  @Test
  void resolve_shouldAcceptDriftAtTolerance() {
    List<ChapterMarker> markers = resolver.resolve(tracks(500_000L, 500_000L), 1_150_000L);

    assertThat(markers.get(1).endMs()).isEqualTo(1_150_000L);
  }

  @Test
  void resolve_shouldRejectEmptyTrackList() {
    assertThatThrownBy(() -> resolver.resolve(List.of(), 1_000_000L))
        .isInstanceOf(UnresolvableTimecodesException.class)
        .hasMessageContaining("no tracks");
  }

  @Test
  void resolve_shouldRejectZeroNominalTotal() {
    assertThatThrownBy(() -> resolver.resolve(tracks(0L, 0L), 1_000_000L))
        .isInstanceOf(UnresolvableTimecodesException.class)
        .satisfies(
            e ->
                assertThat(((UnresolvableTimecodesException) e).kind())
                    .isEqualTo(FailureKind.UNRESOLVABLE_TIMECODES));
  }

  @Test
  void resolve_shouldRejectTrackThatResolvesToNothing() {
    assertThatThrownBy(() -> resolver.resolve(tracks(500_000L, 0L, 500_000L), 1_000_000L))
        .isInstanceOf(UnresolvableTimecodesException.class)
        .hasMessageContaining("Track 1");
  }

  @Test
  void resolve_shouldRejectNonPositiveActualDuration() {
    assertThatThrownBy(() -> resolver.resolve(tracks(1_000L), 0L))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void resolve_shouldFallBackToNumberedTitle() {
    List<CatalogTrack> tracks =
        List.of(new CatalogTrack(0, "  Prologue ", 1_000L), new CatalogTrack(1, " ", 1_000L));

    List<ChapterMarker> markers = resolver.resolve(tracks, 2_000L);

    assertThat(markers).extracting(ChapterMarker::title).containsExactly("Prologue", "Chapter 2");
  }

  private static List<CatalogTrack> tracks(long... durations) {
    List<CatalogTrack> tracks = new ArrayList<>();
    for (int i = 0; i < durations.length; i++) {
      tracks.add(new CatalogTrack(i, "Chapter " + (i + 1), durations[i]));
    }
    return tracks;
  }
}
