package com.scholary.chaptify.identity;

/** Where an identity key was taken from. */
public enum IdentitySource {
  TAGS,
  FILENAME
}
