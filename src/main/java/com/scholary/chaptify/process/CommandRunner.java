package com.scholary.chaptify.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program synchronously.
 *
 * <p>This abstraction lets ffmpeg and ffprobe be replaced by fakes in tests.
 */
public interface CommandRunner {

  /**
   * Run a command and wait for it.
   *
   * @param command program and arguments
   * @param timeout how long to wait before killing the process
   * @return the exit code, timeout flag and captured output
   * @throws IOException if the process cannot be started or its wait is interrupted
   */
  CommandResult run(List<String> command, Duration timeout) throws IOException;
}
