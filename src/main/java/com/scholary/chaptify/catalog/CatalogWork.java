package com.scholary.chaptify.catalog;

import java.util.List;

/** A matched work together with its ordered track listing. */
public record CatalogWork(String id, String title, List<String> authors, List<CatalogTrack> tracks) {

  public CatalogWork {
    authors = List.copyOf(authors);
    tracks = List.copyOf(tracks);
  }

  public static CatalogWork of(WorkSummary summary, List<CatalogTrack> tracks) {
    return new CatalogWork(summary.id(), summary.title(), summary.authors(), tracks);
  }

  public String author() {
    return String.join(", ", authors);
  }
}
