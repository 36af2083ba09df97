package com.scholary.chaptify.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.chaptify.catalog.CatalogException;
import com.scholary.chaptify.catalog.CatalogException.Reason;
import com.scholary.chaptify.catalog.CatalogTrack;
import com.scholary.chaptify.catalog.CatalogWork;
import com.scholary.chaptify.timecode.ChapterMarker;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchChapterizerTest {

  private static final Path FIRST = Path.of("/books/A - One.m4b");
  private static final Path SECOND = Path.of("/books/B - Two.m4b");
  private static final Path THIRD = Path.of("/books/C - Three.m4b");

  @Mock private ChapterizationPipeline pipeline;

  private BatchChapterizer batchChapterizer;

  @BeforeEach
  void setUp() {
    batchChapterizer = new BatchChapterizer(pipeline, Runnable::run);
  }

  @Test
  void run_shouldReportEachFileInSubmissionOrder() {
    ChapterizationRequest first = ChapterizationRequest.inPlace(FIRST);
    ChapterizationRequest second = ChapterizationRequest.inPlace(SECOND);
    ChapterizationRequest third = ChapterizationRequest.inPlace(THIRD);
    when(pipeline.chapterize(first)).thenReturn(result(FIRST));
    when(pipeline.chapterize(second))
        .thenThrow(new CatalogException(Reason.NOT_FOUND, "status 404"));
    when(pipeline.chapterize(third)).thenReturn(result(THIRD));

    BatchReport report = batchChapterizer.run(List.of(first, second, third));

    assertThat(report.outcomes()).extracting(FileOutcome::source).containsExactly(FIRST, SECOND, THIRD);
    assertThat(report.succeeded()).isEqualTo(2);
    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.allSucceeded()).isFalse();

    FileOutcome failed = report.outcomes().get(1);
    assertThat(failed.succeeded()).isFalse();
    assertThat(failed.failureKind()).isEqualTo(FailureKind.CATALOG);
    assertThat(failed.failureMessage()).isEqualTo("NOT_FOUND: status 404");
  }

  @Test
  void run_shouldContainUnexpectedErrorsToTheirFile() {
    ChapterizationRequest first = ChapterizationRequest.inPlace(FIRST);
    ChapterizationRequest second = ChapterizationRequest.inPlace(SECOND);
    when(pipeline.chapterize(first)).thenThrow(new IllegalStateException("boom"));
    when(pipeline.chapterize(second)).thenReturn(result(SECOND));

    BatchReport report = batchChapterizer.run(List.of(first, second));

    FileOutcome unexpected = report.outcomes().get(0);
    assertThat(unexpected.failureKind()).isNull();
    assertThat(unexpected.failureMessage()).contains("boom");
    assertThat(report.outcomes().get(1).succeeded()).isTrue();
  }

  @Test
  void run_shouldProcessFilesOnExecutorThreads() {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      BatchChapterizer concurrent = new BatchChapterizer(pipeline, executor);
      ChapterizationRequest first = ChapterizationRequest.inPlace(FIRST);
      ChapterizationRequest second = ChapterizationRequest.inPlace(SECOND);
      when(pipeline.chapterize(first)).thenReturn(result(FIRST));
      when(pipeline.chapterize(second)).thenReturn(result(SECOND));

      BatchReport report = concurrent.run(List.of(first, second));

      assertThat(report.allSucceeded()).isTrue();
      verify(pipeline).chapterize(first);
      verify(pipeline).chapterize(second);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void run_shouldReturnEmptyReportForNoRequests() {
    BatchReport report = batchChapterizer.run(List.of());

    assertThat(report.outcomes()).isEmpty();
    assertThat(report.allSucceeded()).isTrue();
  }

  private static ChapterizationResult result(Path source) {
    CatalogWork work =
        new CatalogWork(
            "w-" + source.getFileName(),
            "Title",
            List.of("Author"),
            List.of(new CatalogTrack(0, "Chapter 1", 1_000L)));
    return new ChapterizationResult(
        source,
        source,
        work,
        List.of(new ChapterMarker(0, "Chapter 1", 0L, 1_000L)),
        ";FFMETADATA1\n",
        false);
  }
}
