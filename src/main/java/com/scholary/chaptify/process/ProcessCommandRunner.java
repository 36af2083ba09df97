package com.scholary.chaptify.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output is redirected to a temporary file rather than read from a pipe, so a chatty process can
 * never block on a full pipe buffer while we wait for it.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

  // Keep only the tail of very long outputs
  private static final int MAX_OUTPUT_CHARS = 16 * 1024;

  private static final long KILL_WAIT_SECONDS = 10;

  @Override
  public CommandResult run(List<String> command, Duration timeout) throws IOException {
    Path outputFile = Files.createTempFile("chaptify-cmd-", ".log");
    try {
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectErrorStream(true);
      pb.redirectOutput(outputFile.toFile());

      LOGGER.debug("Executing: {}", String.join(" ", command));
      Process process = pb.start();

      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new IOException(command.get(0) + " interrupted", e);
      }

      if (!finished) {
        LOGGER.warn("{} did not finish within {}ms, killing it", command.get(0), timeout.toMillis());
        kill(process, command.get(0));
        return CommandResult.timeout(readOutput(outputFile));
      }

      int exitCode = process.exitValue();
      LOGGER.debug("{} exited with code {}", command.get(0), exitCode);
      return new CommandResult(exitCode, false, readOutput(outputFile));

    } finally {
      Files.deleteIfExists(outputFile);
    }
  }

  /** Kill the process and wait until it has exited, so it no longer holds its output files. */
  private static void kill(Process process, String program) throws IOException {
    try {
      if (!process.destroyForcibly().waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.error("{} still running {}s after being killed", program, KILL_WAIT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(program + " interrupted while being killed", e);
    }
  }

  private static String readOutput(Path outputFile) throws IOException {
    String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8).trim();
    if (output.length() > MAX_OUTPUT_CHARS) {
      return output.substring(output.length() - MAX_OUTPUT_CHARS);
    }
    return output;
  }
}
