package com.scholary.chaptify.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command line: a subcommand, positional arguments, valued options and flags.
 *
 * <p>Valued options accept both {@code --name value} and {@code --name=value}.
 */
record CommandLineArguments(
    String command, List<String> positionals, Map<String, String> options, Set<String> flags) {

  static final String COMMAND_CHAPTERIZE = "chapterize";
  static final String COMMAND_BATCH = "batch";

  static final String OUTPUT_OPTION = "--output";
  static final String OUTPUT_DIR_OPTION = "--output-dir";
  static final String DIR_OPTION = "--dir";
  static final String LIST_OPTION = "--list";
  static final String DRY_RUN_FLAG = "--dry-run";
  static final String HELP_FLAG = "--help";

  private static final Set<String> VALUED_OPTIONS =
      Set.of(OUTPUT_OPTION, OUTPUT_DIR_OPTION, DIR_OPTION, LIST_OPTION);
  private static final Set<String> FLAGS = Set.of(DRY_RUN_FLAG, HELP_FLAG);

  /**
   * Parse raw arguments.
   *
   * @throws IllegalArgumentException on an unknown option or a missing option value
   */
  static CommandLineArguments parse(String... args) {
    String command = null;
    List<String> positionals = new ArrayList<>();
    Map<String, String> options = new HashMap<>();
    Set<String> flags = new HashSet<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg.startsWith("--")) {
        int eq = arg.indexOf('=');
        String name = eq > 0 ? arg.substring(0, eq) : arg;

        if (FLAGS.contains(name) && eq < 0) {
          flags.add(name);
        } else if (VALUED_OPTIONS.contains(name)) {
          String value;
          if (eq > 0) {
            value = arg.substring(eq + 1);
          } else if (i + 1 < args.length) {
            value = args[++i];
          } else {
            throw new IllegalArgumentException("Missing value for " + name);
          }
          if (value.isBlank()) {
            throw new IllegalArgumentException("Empty value for " + name);
          }
          options.put(name, value);
        } else {
          throw new IllegalArgumentException("Unknown option: " + arg);
        }
      } else if (command == null) {
        command = arg;
      } else {
        positionals.add(arg);
      }
    }

    return new CommandLineArguments(command, positionals, options, flags);
  }

  Optional<String> option(String name) {
    return Optional.ofNullable(options.get(name));
  }

  boolean hasFlag(String name) {
    return flags.contains(name);
  }
}
