package com.scholary.chaptify.pipeline;

/** The kind of failure that stopped a chapterization run. */
public enum FailureKind {
  IDENTITY,
  CATALOG,
  NO_MATCH,
  AMBIGUOUS_MATCH,
  UNRESOLVABLE_TIMECODES,
  DURATION_MISMATCH,
  PROBE,
  REMUX
}
