package com.scholary.livefeed.source;

public enum SourceKind {
  LOOPED_FILE,
  NETWORK_FEED
}
