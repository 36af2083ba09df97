package com.scholary.chaptify.matching;

import com.scholary.chaptify.catalog.CatalogTrack;
import java.util.List;

/** Loads a candidate's track listing when the matcher needs its total duration. */
@FunctionalInterface
public interface TrackLoader {

  List<CatalogTrack> load(String workId);
}
