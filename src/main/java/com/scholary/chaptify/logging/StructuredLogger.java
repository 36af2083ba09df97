package com.scholary.chaptify.logging;

import com.scholary.chaptify.identity.IdentitySource;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each pipeline event puts its fields into the MDC for the duration of one log call, so a JSON
 * encoder or log shipper can index them. The per-file context stays set for a whole run.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log identity resolved event. */
  public void logIdentityResolved(IdentitySource source, String author, String title) {
    try {
      MDC.put("event_type", "identity_resolved");
      MDC.put("source", source.name());
      MDC.put("author", author);
      MDC.put("title", title);

      logger.info("Identity resolved: source={}, author='{}', title='{}'", source, author, title);
    } finally {
      clearEventFields();
    }
  }

  /** Log catalog retry event. */
  public void logCatalogRetry(
      String operation, int attempt, int maxAttempts, long backoffMs, String message) {
    try {
      MDC.put("event_type", "catalog_retry");
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("backoffMs", String.valueOf(backoffMs));

      logger.warn(
          "Catalog retry: operation={}, attempt={}/{}, backoff={}ms, message={}",
          operation,
          attempt,
          maxAttempts,
          backoffMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log catalog failure event. */
  public void logCatalogFailed(String operation, int attempts, String reason, String message) {
    try {
      MDC.put("event_type", "catalog_failed");
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", reason);

      logger.error(
          "Catalog failed: operation={}, attempts={}, reason={}, message={}",
          operation,
          attempts,
          reason,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log work matched event. */
  public void logWorkMatched(
      String workId, String title, int score, int candidateCount, String decidedBy) {
    try {
      MDC.put("event_type", "work_matched");
      MDC.put("workId", workId);
      MDC.put("score", String.valueOf(score));
      MDC.put("candidates", String.valueOf(candidateCount));
      MDC.put("decidedBy", decidedBy);

      logger.info(
          "Work matched: id={}, title='{}', score={}, candidates={}, decidedBy={}",
          workId,
          title,
          score,
          candidateCount,
          decidedBy);
    } finally {
      clearEventFields();
    }
  }

  /** Log chapters resolved event. */
  public void logChaptersResolved(
      int chapterCount, long nominalTotalMs, long actualDurationMs, double drift, long residualMs) {
    try {
      MDC.put("event_type", "chapters_resolved");
      MDC.put("chapters", String.valueOf(chapterCount));
      MDC.put("nominalTotalMs", String.valueOf(nominalTotalMs));
      MDC.put("actualDurationMs", String.valueOf(actualDurationMs));
      MDC.put("drift", String.format("%.4f", drift));
      MDC.put("residualMs", String.valueOf(residualMs));

      logger.info(
          "Chapters resolved: count={}, nominal={}ms, actual={}ms, drift={}%, residual={}ms",
          chapterCount,
          nominalTotalMs,
          actualDurationMs,
          String.format("%.2f", drift * 100),
          residualMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log remux finished event. {@code message} is null on success. */
  public void logRemuxFinished(String outcome, long elapsedMs, String message) {
    try {
      MDC.put("event_type", "remux_finished");
      MDC.put("outcome", outcome);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      if (message == null) {
        logger.info("Remux finished: outcome={}, elapsed={}ms", outcome, elapsedMs);
      } else {
        logger.error(
            "Remux finished: outcome={}, elapsed={}ms, message={}", outcome, elapsedMs, message);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log file finished event. */
  public void logFileFinished(String outcome, int chapterCount, long elapsedMs) {
    try {
      MDC.put("event_type", "file_finished");
      MDC.put("outcome", outcome);
      MDC.put("chapters", String.valueOf(chapterCount));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "File finished: outcome={}, chapters={}, elapsed={}ms", outcome, chapterCount, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set file context in MDC. */
  public static void setFileContext(Path file) {
    MDC.put("file", String.valueOf(file.getFileName()));
  }

  /** Clear file context from MDC. */
  public static void clearFileContext() {
    MDC.remove("file");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("source");
    MDC.remove("author");
    MDC.remove("title");
    MDC.remove("operation");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("backoffMs");
    MDC.remove("errorType");
    MDC.remove("workId");
    MDC.remove("score");
    MDC.remove("candidates");
    MDC.remove("decidedBy");
    MDC.remove("chapters");
    MDC.remove("nominalTotalMs");
    MDC.remove("actualDurationMs");
    MDC.remove("drift");
    MDC.remove("residualMs");
    MDC.remove("outcome");
    MDC.remove("elapsedMs");
  }
}
