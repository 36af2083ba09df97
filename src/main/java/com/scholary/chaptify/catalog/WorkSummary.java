package com.scholary.chaptify.catalog;

import java.util.List;

/** A search hit: enough to match against, without the track listing. */
public record WorkSummary(String id, String title, List<String> authors, int totalTracks) {

  public WorkSummary {
    authors = List.copyOf(authors);
  }

  public String author() {
    return String.join(", ", authors);
  }
}
