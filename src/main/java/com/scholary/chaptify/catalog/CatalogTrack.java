package com.scholary.chaptify.catalog;

/**
 * One entry of a work's track listing, in catalog order.
 *
 * <p>A zero duration is representable; deciding whether it is usable is up to the timecode
 * resolver.
 */
public record CatalogTrack(int index, String name, long nominalDurationMs) {

  public CatalogTrack {
    if (index < 0) {
      throw new IllegalArgumentException("Track index cannot be negative");
    }
    if (nominalDurationMs < 0) {
      throw new IllegalArgumentException("Nominal duration cannot be negative");
    }
    name = name == null ? "" : name;
  }
}
