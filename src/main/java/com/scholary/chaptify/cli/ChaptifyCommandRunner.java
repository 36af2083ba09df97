package com.scholary.chaptify.cli;

import static com.scholary.chaptify.cli.CommandLineArguments.COMMAND_BATCH;
import static com.scholary.chaptify.cli.CommandLineArguments.COMMAND_CHAPTERIZE;
import static com.scholary.chaptify.cli.CommandLineArguments.DIR_OPTION;
import static com.scholary.chaptify.cli.CommandLineArguments.DRY_RUN_FLAG;
import static com.scholary.chaptify.cli.CommandLineArguments.HELP_FLAG;
import static com.scholary.chaptify.cli.CommandLineArguments.LIST_OPTION;
import static com.scholary.chaptify.cli.CommandLineArguments.OUTPUT_DIR_OPTION;
import static com.scholary.chaptify.cli.CommandLineArguments.OUTPUT_OPTION;

import com.scholary.chaptify.pipeline.BatchChapterizer;
import com.scholary.chaptify.pipeline.BatchReport;
import com.scholary.chaptify.pipeline.ChapterizationPipeline;
import com.scholary.chaptify.pipeline.ChapterizationRequest;
import com.scholary.chaptify.pipeline.ChapterizationResult;
import com.scholary.chaptify.pipeline.FileOutcome;
import com.scholary.chaptify.pipeline.PipelineException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line entry point.
 *
 * <pre>
 * chapterize &lt;file&gt; [--output &lt;path&gt;] [--dry-run]
 * batch (--dir &lt;directory&gt; | --list &lt;file&gt;) [--output-dir &lt;directory&gt;] [--dry-run]
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 a file failed, 2 usage error. Failures are printed to stderr as
 * {@code <KIND>: <message>}.
 */
@Component
public class ChaptifyCommandRunner implements CommandLineRunner, ExitCodeGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChaptifyCommandRunner.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage:",
          "  chapterize <file> [--output <path>] [--dry-run]",
          "  batch (--dir <directory> | --list <file>) [--output-dir <directory>] [--dry-run]");

  private final ChapterizationPipeline pipeline;
  private final BatchChapterizer batchChapterizer;
  private final PrintStream out;
  private final PrintStream err;
  private int exitCode = EXIT_OK;

  @Autowired
  public ChaptifyCommandRunner(ChapterizationPipeline pipeline, BatchChapterizer batchChapterizer) {
    this(pipeline, batchChapterizer, System.out, System.err);
  }

  ChaptifyCommandRunner(
      ChapterizationPipeline pipeline,
      BatchChapterizer batchChapterizer,
      PrintStream out,
      PrintStream err) {
    this.pipeline = pipeline;
    this.batchChapterizer = batchChapterizer;
    this.out = out;
    this.err = err;
  }

  @Override
  public void run(String... args) {
    exitCode = execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int execute(String... args) {
    CommandLineArguments arguments;
    try {
      arguments = CommandLineArguments.parse(args);
    } catch (IllegalArgumentException e) {
      return usageError(e.getMessage());
    }

    if (arguments.hasFlag(HELP_FLAG)) {
      out.println(USAGE);
      return EXIT_OK;
    }
    if (arguments.command() == null) {
      return usageError("No command given");
    }

    switch (arguments.command()) {
      case COMMAND_CHAPTERIZE:
        return chapterize(arguments);
      case COMMAND_BATCH:
        return batch(arguments);
      default:
        return usageError("Unknown command: " + arguments.command());
    }
  }

  private int chapterize(CommandLineArguments arguments) {
    if (arguments.positionals().size() != 1) {
      return usageError("chapterize takes exactly one file");
    }
    if (arguments.option(OUTPUT_DIR_OPTION).isPresent()
        || arguments.option(DIR_OPTION).isPresent()
        || arguments.option(LIST_OPTION).isPresent()) {
      return usageError("chapterize accepts only --output and --dry-run");
    }

    Path source = Path.of(arguments.positionals().get(0));
    if (!Files.isRegularFile(source)) {
      return usageError("File not found: " + source);
    }
    Path destination = arguments.option(OUTPUT_OPTION).map(Path::of).orElse(source);
    boolean dryRun = arguments.hasFlag(DRY_RUN_FLAG);

    try {
      ChapterizationResult result =
          pipeline.chapterize(new ChapterizationRequest(source, destination, dryRun));
      if (dryRun) {
        out.print(result.controlFile());
      }
      out.println(describeSuccess(result));
      return EXIT_OK;
    } catch (PipelineException e) {
      err.println(e.kind() + ": " + e.getMessage());
      return EXIT_FAILED;
    }
  }

  private int batch(CommandLineArguments arguments) {
    Optional<String> dir = arguments.option(DIR_OPTION);
    Optional<String> list = arguments.option(LIST_OPTION);
    if (dir.isPresent() == list.isPresent()) {
      return usageError("batch needs exactly one of --dir or --list");
    }
    if (!arguments.positionals().isEmpty() || arguments.option(OUTPUT_OPTION).isPresent()) {
      return usageError("batch takes no file arguments and no --output; use --output-dir");
    }

    List<Path> sources;
    try {
      sources = dir.isPresent() ? listDirectory(Path.of(dir.get())) : readList(Path.of(list.get()));
    } catch (IllegalArgumentException e) {
      return usageError(e.getMessage());
    } catch (IOException e) {
      LOGGER.error("Could not collect batch inputs", e);
      err.println("Could not collect batch inputs: " + e.getMessage());
      return EXIT_FAILED;
    }

    if (sources.isEmpty()) {
      out.println("No files to process");
      return EXIT_OK;
    }

    Optional<Path> outputDir = arguments.option(OUTPUT_DIR_OPTION).map(Path::of);
    boolean dryRun = arguments.hasFlag(DRY_RUN_FLAG);
    List<ChapterizationRequest> requests = new ArrayList<>(sources.size());
    for (Path source : sources) {
      Path destination = outputDir.map(d -> d.resolve(source.getFileName())).orElse(source);
      requests.add(new ChapterizationRequest(source, destination, dryRun));
    }
    if (!dryRun) {
      Optional<Path> clash = firstDuplicateDestination(requests);
      if (clash.isPresent()) {
        return usageError("Several inputs would be written to " + clash.get());
      }
    }

    BatchReport report = batchChapterizer.run(requests);
    for (FileOutcome outcome : report.outcomes()) {
      if (outcome.succeeded()) {
        out.println(describeSuccess(outcome.result()));
      } else {
        String kind = outcome.failureKind() == null ? "ERROR" : outcome.failureKind().name();
        err.println("FAILED " + outcome.source() + ": " + kind + ": " + outcome.failureMessage());
      }
    }
    out.printf("%d succeeded, %d failed%n", report.succeeded(), report.failed());
    return report.allSucceeded() ? EXIT_OK : EXIT_FAILED;
  }

  private static Optional<Path> firstDuplicateDestination(List<ChapterizationRequest> requests) {
    Set<Path> seen = new HashSet<>();
    for (ChapterizationRequest request : requests) {
      Path destination = request.destination().toAbsolutePath().normalize();
      if (!seen.add(destination)) {
        return Optional.of(destination);
      }
    }
    return Optional.empty();
  }

  private static List<Path> listDirectory(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      throw new IllegalArgumentException("Not a directory: " + directory);
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".m4b"))
          .filter(p -> !p.getFileName().toString().startsWith("."))
          .sorted()
          .toList();
    }
  }

  /** One path per line; blank lines and lines starting with '#' are skipped. */
  private static List<Path> readList(Path listFile) throws IOException {
    if (!Files.isRegularFile(listFile)) {
      throw new IllegalArgumentException("List file not found: " + listFile);
    }
    return Files.readAllLines(listFile, StandardCharsets.UTF_8).stream()
        .map(String::trim)
        .filter(line -> !line.isEmpty() && !line.startsWith("#"))
        .map(Path::of)
        .toList();
  }

  private static String describeSuccess(ChapterizationResult result) {
    String target = result.dryRun() ? "(dry run)" : "-> " + result.output();
    return String.format(
        "OK %s %s: %d chapters from '%s' by %s [%s]",
        result.source(),
        target,
        result.chapters().size(),
        result.work().title(),
        result.work().author(),
        result.work().id());
  }

  private int usageError(String message) {
    err.println(message);
    err.println(USAGE);
    return EXIT_USAGE;
  }
}
