package com.scholary.chaptify.process;

/**
 * Outcome of an external command.
 *
 * <p>{@code output} is the combined stdout/stderr. When {@code timedOut} is true the process was
 * killed and {@code exitCode} is meaningless.
 */
public record CommandResult(int exitCode, boolean timedOut, String output) {

  public static CommandResult timeout(String output) {
    return new CommandResult(-1, true, output);
  }
}
