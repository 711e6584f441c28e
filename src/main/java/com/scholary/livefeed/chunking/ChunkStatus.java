package com.scholary.livefeed.chunking;

public enum ChunkStatus {
  EXTRACTING,
  READY,
  ERROR
}
