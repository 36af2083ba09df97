package com.scholary.chaptify.catalog;

import com.scholary.chaptify.identity.IdentityKey;
import java.util.List;

/**
 * Typed access to the external audiobook catalog.
 *
 * <p>Implementations perform exactly one logical call per method and never retry on their own;
 * retries and rate limiting belong to the caller.
 */
public interface CatalogClient {

  /**
   * Search for works matching an identity.
   *
   * @param key the normalized author and title
   * @return candidates in provider relevance order, possibly empty
   * @throws CatalogException if the call fails
   */
  List<WorkSummary> search(IdentityKey key);

  /**
   * Fetch the complete, ordered track listing of a work.
   *
   * @param workId the catalog id returned by {@link #search}
   * @return the tracks in catalog order
   * @throws CatalogException if the call fails
   */
  List<CatalogTrack> fetchTracks(String workId);
}
