package com.scholary.chaptify.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the pipeline over many files in parallel.
 *
 * <p>Each file gets an independent pipeline run on the batch executor. The only shared resource is
 * the catalog rate limiter inside {@link CatalogRetryPolicy}. A failed file never stops the others.
 */
@Service
public class BatchChapterizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchChapterizer.class);

  private final ChapterizationPipeline pipeline;
  private final Executor executor;

  public BatchChapterizer(
      ChapterizationPipeline pipeline, @Qualifier("batchExecutor") Executor executor) {
    this.pipeline = pipeline;
    this.executor = executor;
  }

  /**
   * Chapterize every request and wait for all of them.
   *
   * @param requests files to process
   * @return one outcome per request, in the same order
   */
  public BatchReport run(List<ChapterizationRequest> requests) {
    LOGGER.info("Starting batch of {} files", requests.size());

    List<CompletableFuture<FileOutcome>> futures = new ArrayList<>(requests.size());
    for (ChapterizationRequest request : requests) {
      futures.add(CompletableFuture.supplyAsync(() -> process(request), executor));
    }

    List<FileOutcome> outcomes = new ArrayList<>(futures.size());
    for (CompletableFuture<FileOutcome> future : futures) {
      outcomes.add(future.join());
    }

    BatchReport report = new BatchReport(outcomes);
    LOGGER.info("Batch finished: {} succeeded, {} failed", report.succeeded(), report.failed());
    return report;
  }

  private FileOutcome process(ChapterizationRequest request) {
    try {
      return FileOutcome.success(pipeline.chapterize(request));
    } catch (PipelineException e) {
      LOGGER.warn("Failed {}: {} {}", request.source(), e.kind(), e.getMessage());
      return FileOutcome.failure(request.source(), e);
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error processing {}", request.source(), e);
      return FileOutcome.unexpected(request.source(), e);
    }
  }
}
