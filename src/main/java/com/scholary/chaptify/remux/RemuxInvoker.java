package com.scholary.chaptify.remux;

import com.scholary.chaptify.logging.StructuredLogger;
import com.scholary.chaptify.probe.AudioProbe;
import com.scholary.chaptify.probe.AudioProbeException;
import com.scholary.chaptify.probe.AudioProber;
import com.scholary.chaptify.process.CommandResult;
import com.scholary.chaptify.process.CommandRunner;
import com.scholary.chaptify.remux.RemuxException.Reason;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embeds a chapter table into an audio container with ffmpeg, copying every stream unchanged.
 *
 * <p>The steps are:
 *
 * <ol>
 *   <li>Write the ffmetadata control text to a temporary file
 *   <li>Run ffmpeg with stream copy into a hidden sibling of the destination
 *   <li>Check the exit code, that the output is non-empty, and that its duration matches the
 *       source within {@code ffmpeg.durationToleranceMs}
 *   <li>Move the output over the destination
 * </ol>
 *
 * <p>If any step fails the temporary files are removed and the destination is left as it was.
 */
@Component
public class RemuxInvoker {

  private static final Logger LOGGER = LoggerFactory.getLogger(RemuxInvoker.class);

  private final FfmpegProperties properties;
  private final CommandRunner commandRunner;
  private final AudioProber audioProber;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public RemuxInvoker(
      FfmpegProperties properties, CommandRunner commandRunner, AudioProber audioProber) {
    this.properties = properties;
    this.commandRunner = commandRunner;
    this.audioProber = audioProber;
  }

  /**
   * Embed chapters.
   *
   * @param source the original container
   * @param destination where the chaptered file goes; may equal {@code source}
   * @param controlFile ffmetadata text describing the chapters
   * @param actualDurationMs the source's measured duration
   * @return the destination path
   * @throws RemuxException if ffmpeg fails, times out, or produces an unusable file
   */
  public Path remux(Path source, Path destination, String controlFile, long actualDurationMs) {
    long startNanos = System.nanoTime();
    Path tempOutput = temporarySibling(source, destination);
    Path metadataFile = null;

    try {
      // ffmpeg writes the temporary output next to the destination and cannot create directories
      Path parent = destination.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }

      metadataFile = Files.createTempFile("chaptify-", ".ffmeta");
      Files.writeString(metadataFile, controlFile, StandardCharsets.UTF_8);

      CommandResult result =
          commandRunner.run(
              buildCommand(source, metadataFile, tempOutput),
              Duration.ofSeconds(properties.remuxTimeoutSeconds()));

      if (result.timedOut()) {
        throw failure(
            Reason.TIMEOUT,
            String.format("ffmpeg did not finish within %ds", properties.remuxTimeoutSeconds()),
            startNanos);
      }
      if (result.exitCode() != 0) {
        LOGGER.error("ffmpeg failed: source={}, output={}", source, result.output());
        throw failure(
            Reason.NON_ZERO_EXIT,
            String.format("ffmpeg exited with code %d: %s", result.exitCode(), result.output()),
            startNanos);
      }

      verifyOutput(tempOutput, actualDurationMs, startNanos);
      replace(tempOutput, destination);

      structuredLogger.logRemuxFinished("success", elapsedMs(startNanos), null);
      return destination;

    } catch (IOException e) {
      structuredLogger.logRemuxFinished(Reason.IO.name(), elapsedMs(startNanos), e.getMessage());
      throw new RemuxException(Reason.IO, "Remux of " + source.getFileName() + " failed", e);
    } finally {
      deleteIfPresent(tempOutput);
      deleteIfPresent(metadataFile);
    }
  }

  /**
   * ffmpeg arguments:
   *
   * <ul>
   *   <li>-map 0:a -map 0:v?: audio plus cover art, if any; old chapter text tracks are dropped
   *   <li>-map_metadata 0: keep the source's global tags
   *   <li>-map_chapters 1: take chapters from the control file only
   *   <li>-c copy: no re-encoding
   * </ul>
   */
  List<String> buildCommand(Path source, Path metadataFile, Path output) {
    return List.of(
        properties.ffmpegPath(),
        "-nostdin",
        "-hide_banner",
        "-loglevel", "error",
        "-y",
        "-i", source.toString(),
        "-i", metadataFile.toString(),
        "-map", "0:a",
        "-map", "0:v?",
        "-map_metadata", "0",
        "-map_chapters", "1",
        "-c", "copy",
        output.toString());
  }

  private void verifyOutput(Path output, long expectedDurationMs, long startNanos)
      throws IOException {
    if (!Files.isRegularFile(output) || Files.size(output) == 0) {
      throw failure(Reason.INVALID_OUTPUT, "ffmpeg reported success but wrote no output", startNanos);
    }

    AudioProbe probe;
    try {
      probe = audioProber.probe(output);
    } catch (AudioProbeException e) {
      structuredLogger.logRemuxFinished(
          Reason.INVALID_OUTPUT.name(), elapsedMs(startNanos), e.getMessage());
      throw new RemuxException(Reason.INVALID_OUTPUT, "Remuxed file cannot be probed", e);
    }

    long delta = Math.abs(probe.actualDurationMs() - expectedDurationMs);
    if (delta > properties.durationToleranceMs()) {
      throw failure(
          Reason.INVALID_OUTPUT,
          String.format(
              "Remuxed duration %d ms differs from source %d ms by %d ms (tolerance %d ms)",
              probe.actualDurationMs(), expectedDurationMs, delta,
              properties.durationToleranceMs()),
          startNanos);
    }
  }

  private void replace(Path tempOutput, Path destination) throws IOException {
    try {
      Files.move(
          tempOutput,
          destination,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.warn("Atomic move not supported for {}, falling back to replace", destination);
      Files.move(tempOutput, destination, StandardCopyOption.REPLACE_EXISTING);
    }
    LOGGER.info("Wrote chapters to {}", destination);
  }

  /** Hidden sibling of the destination that keeps the extension ffmpeg picks the muxer from. */
  static Path temporarySibling(Path source, Path destination) {
    String extension = extensionOf(destination);
    if (extension.isEmpty()) {
      extension = extensionOf(source);
    }
    String name = destination.getFileName().toString();
    String stem = name.endsWith(extension) ? name.substring(0, name.length() - extension.length()) : name;
    return destination.resolveSibling("." + stem + ".chaptify-" + UUID.randomUUID() + extension);
  }

  private static String extensionOf(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(dot) : "";
  }

  private RemuxException failure(Reason reason, String message, long startNanos) {
    structuredLogger.logRemuxFinished(reason.name(), elapsedMs(startNanos), message);
    return new RemuxException(reason, message);
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static void deleteIfPresent(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Could not delete temporary file {}: {}", path, e.getMessage());
    }
  }
}
