package com.scholary.chaptify.pipeline;

import com.scholary.chaptify.catalog.CatalogProperties;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Spaces catalog requests at least {@code catalog.minRequestIntervalMs} apart.
 *
 * <p>One instance is shared by every pipeline running in the process. Callers reserve the next
 * free slot under the lock and sleep outside it, so waiting threads do not block each other's
 * reservations.
 */
@Component
public class CatalogRateLimiter {

  private final long minIntervalNanos;
  private long nextSlotNanos;

  public CatalogRateLimiter(CatalogProperties properties) {
    this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(properties.minRequestIntervalMs());
    this.nextSlotNanos = System.nanoTime();
  }

  /**
   * Block until the caller may issue a request.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void acquire() throws InterruptedException {
    long waitNanos;
    synchronized (this) {
      long now = System.nanoTime();
      long slot = now - nextSlotNanos >= 0 ? now : nextSlotNanos;
      nextSlotNanos = slot + minIntervalNanos;
      waitNanos = slot - now;
    }
    if (waitNanos > 0) {
      TimeUnit.NANOSECONDS.sleep(waitNanos);
    }
  }
}
