package com.scholary.chaptify.probe;

import com.scholary.chaptify.process.CommandResult;
import com.scholary.chaptify.process.CommandRunner;
import com.scholary.chaptify.remux.FfmpegProperties;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a container's duration with ffprobe.
 *
 * <p>ffprobe prints the format duration in seconds with microsecond precision (e.g. {@code
 * 41235.146032}); it is rounded half-up to whole milliseconds.
 */
@Component
public class FfprobeAudioProber implements AudioProber {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeAudioProber.class);

  private final FfmpegProperties properties;
  private final CommandRunner commandRunner;

  public FfprobeAudioProber(FfmpegProperties properties, CommandRunner commandRunner) {
    this.properties = properties;
    this.commandRunner = commandRunner;
  }

  @Override
  public AudioProbe probe(Path file) {
    // -show_entries format=duration: container duration only
    // -of default=noprint_wrappers=1:nokey=1: print the bare value
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v", "error",
            "-show_entries", "format=duration",
            "-of", "default=noprint_wrappers=1:nokey=1",
            file.toString());

    CommandResult result;
    try {
      result = commandRunner.run(command, Duration.ofSeconds(properties.probeTimeoutSeconds()));
    } catch (IOException e) {
      throw new AudioProbeException("Could not run ffprobe on " + file.getFileName(), e);
    }

    if (result.timedOut()) {
      throw new AudioProbeException(
          String.format(
              "ffprobe timed out after %ds on %s",
              properties.probeTimeoutSeconds(), file.getFileName()));
    }
    if (result.exitCode() != 0) {
      LOGGER.error("ffprobe failed: file={}, output={}", file, result.output());
      throw new AudioProbeException(
          String.format(
              "ffprobe failed with exit code %d on %s: %s",
              result.exitCode(), file.getFileName(), result.output()));
    }

    long durationMs = parseDurationMs(result.output(), file);
    LOGGER.debug("Probed {}: {} ms", file.getFileName(), durationMs);
    return new AudioProbe(file, durationMs);
  }

  static long parseDurationMs(String output, Path file) {
    String value = output.lines().map(String::trim).filter(l -> !l.isEmpty()).reduce((a, b) -> b)
        .orElse("");
    try {
      long durationMs =
          new BigDecimal(value).movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValueExact();
      if (durationMs <= 0) {
        throw new AudioProbeException(
            String.format("ffprobe reported a non-positive duration for %s: %s", file.getFileName(), value));
      }
      return durationMs;
    } catch (NumberFormatException | ArithmeticException e) {
      throw new AudioProbeException(
          String.format("ffprobe reported no usable duration for %s: '%s'", file.getFileName(), value),
          e);
    }
  }
}
