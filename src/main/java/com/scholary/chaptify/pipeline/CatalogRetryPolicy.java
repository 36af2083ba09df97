package com.scholary.chaptify.pipeline;

import com.scholary.chaptify.catalog.CatalogException;
import com.scholary.chaptify.catalog.CatalogProperties;
import com.scholary.chaptify.logging.StructuredLogger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded retry with exponential backoff around catalog calls.
 *
 * <p>Only {@link CatalogException.Reason#TRANSIENT} failures are retried. Attempt {@code n} (from
 * 1) is followed by a pause of {@code initialBackoffMs * 2^(n-1)}. Every attempt first takes a slot
 * from the shared {@link CatalogRateLimiter}.
 */
@Component
public class CatalogRetryPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(CatalogRetryPolicy.class);

  private final int maxAttempts;
  private final long initialBackoffMs;
  private final CatalogRateLimiter rateLimiter;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public CatalogRetryPolicy(CatalogProperties properties, CatalogRateLimiter rateLimiter) {
    this.maxAttempts = properties.maxAttempts();
    this.initialBackoffMs = properties.initialBackoffMs();
    this.rateLimiter = rateLimiter;
  }

  /**
   * Run a catalog call, retrying transient failures.
   *
   * @param operation name used in logs
   * @param call the catalog call
   * @return the call's result
   * @throws CatalogException the last failure, once it is permanent or attempts are exhausted
   */
  public <T> T execute(String operation, Supplier<T> call) {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        rateLimiter.acquire();
        return call.get();

      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CatalogException(
            CatalogException.Reason.TRANSIENT, operation + " interrupted while rate limited", e);

      } catch (CatalogException e) {
        if (!e.isRetryable() || attempt >= maxAttempts || Thread.currentThread().isInterrupted()) {
          structuredLogger.logCatalogFailed(operation, attempt, e.reason().name(), e.getMessage());
          throw e;
        }

        long backoffMs = initialBackoffMs * (1L << (attempt - 1));
        structuredLogger.logCatalogRetry(operation, attempt, maxAttempts, backoffMs, e.getMessage());
        try {
          Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }
}
