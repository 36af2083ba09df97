package com.scholary.chaptify.pipeline;

import com.scholary.chaptify.catalog.CatalogClient;
import com.scholary.chaptify.catalog.CatalogTrack;
import com.scholary.chaptify.catalog.CatalogWork;
import com.scholary.chaptify.catalog.WorkSummary;
import com.scholary.chaptify.emit.ChapterMarkerEmitter;
import com.scholary.chaptify.identity.EmbeddedTagReader;
import com.scholary.chaptify.identity.IdentityExtractor;
import com.scholary.chaptify.identity.IdentityKey;
import com.scholary.chaptify.logging.StructuredLogger;
import com.scholary.chaptify.matching.TrackLoader;
import com.scholary.chaptify.matching.WorkMatcher;
import com.scholary.chaptify.probe.AudioProbe;
import com.scholary.chaptify.probe.AudioProber;
import com.scholary.chaptify.remux.RemuxInvoker;
import com.scholary.chaptify.timecode.ChapterMarker;
import com.scholary.chaptify.timecode.TimecodeResolver;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Chapterizes one audiobook file end to end.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Derive the identity key from embedded tags or the file name
 *   <li>Measure the file's real duration
 *   <li>Search the catalog and match a work, using the measured duration as tie-break hint
 *   <li>Fetch the work's tracks and rescale them to the measured duration
 *   <li>Emit the ffmetadata control file and remux it into the container
 * </ol>
 *
 * <p>The first failure aborts the run and propagates unchanged. Nothing is written before the remux
 * step. The bean holds no per-file state, so files can be processed concurrently.
 */
@Service
public class ChapterizationPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChapterizationPipeline.class);

  private final EmbeddedTagReader tagReader;
  private final IdentityExtractor identityExtractor;
  private final AudioProber audioProber;
  private final CatalogClient catalogClient;
  private final CatalogRetryPolicy retryPolicy;
  private final WorkMatcher workMatcher;
  private final TimecodeResolver timecodeResolver;
  private final ChapterMarkerEmitter emitter;
  private final RemuxInvoker remuxInvoker;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public ChapterizationPipeline(
      EmbeddedTagReader tagReader,
      IdentityExtractor identityExtractor,
      AudioProber audioProber,
      CatalogClient catalogClient,
      CatalogRetryPolicy retryPolicy,
      WorkMatcher workMatcher,
      TimecodeResolver timecodeResolver,
      ChapterMarkerEmitter emitter,
      RemuxInvoker remuxInvoker) {
    this.tagReader = tagReader;
    this.identityExtractor = identityExtractor;
    this.audioProber = audioProber;
    this.catalogClient = catalogClient;
    this.retryPolicy = retryPolicy;
    this.workMatcher = workMatcher;
    this.timecodeResolver = timecodeResolver;
    this.emitter = emitter;
    this.remuxInvoker = remuxInvoker;
  }

  /**
   * Run the pipeline for one file.
   *
   * @param request source, destination and dry-run flag
   * @return the matched work, chapters and control file
   * @throws PipelineException the first failure, as raised by the failing component
   */
  public ChapterizationResult chapterize(ChapterizationRequest request) {
    Path source = request.source();
    long startNanos = System.nanoTime();
    StructuredLogger.setFileContext(source);

    try {
      LOGGER.info("Chapterizing {}", source);

      IdentityKey key = identityExtractor.extract(source, tagReader.read(source));
      AudioProbe probe = audioProber.probe(source);
      LOGGER.info("Measured duration: {} ms", probe.actualDurationMs());

      List<WorkSummary> candidates =
          retryPolicy.execute("search", () -> catalogClient.search(key));

      // Tracks loaded for the tie-break are reused for the selected work
      Map<String, List<CatalogTrack>> loadedTracks = new HashMap<>();
      TrackLoader trackLoader =
          workId ->
              loadedTracks.computeIfAbsent(
                  workId,
                  id -> retryPolicy.execute("fetchTracks", () -> catalogClient.fetchTracks(id)));

      WorkSummary match =
          workMatcher.match(
              key, candidates, OptionalLong.of(probe.actualDurationMs()), trackLoader);
      CatalogWork work = CatalogWork.of(match, trackLoader.load(match.id()));

      List<ChapterMarker> chapters =
          timecodeResolver.resolve(work.tracks(), probe.actualDurationMs());
      String controlFile = emitter.emit(chapters);

      if (request.dryRun()) {
        structuredLogger.logFileFinished("dry_run", chapters.size(), elapsedMs(startNanos));
        return new ChapterizationResult(source, null, work, chapters, controlFile, true);
      }

      Path output =
          remuxInvoker.remux(
              source, request.destination(), controlFile, probe.actualDurationMs());

      structuredLogger.logFileFinished("success", chapters.size(), elapsedMs(startNanos));
      return new ChapterizationResult(source, output, work, chapters, controlFile, false);

    } catch (PipelineException e) {
      structuredLogger.logFileFinished(e.kind().name(), 0, elapsedMs(startNanos));
      throw e;
    } finally {
      StructuredLogger.clearFileContext();
    }
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
