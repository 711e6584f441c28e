package com.scholary.livefeed.source;

import java.nio.file.Path;
import java.util.Objects;

/** A local video file replayed in an endless loop. */
public record LoopedFileSource(Path file) implements StreamSource {

  public LoopedFileSource {
    Objects.requireNonNull(file, "file");
    if (file.toString().isBlank()) {
      throw new IllegalArgumentException("Looped file source requires a file path");
    }
  }

  @Override
  public SourceKind kind() {
    return SourceKind.LOOPED_FILE;
  }

  @Override
  public String describe() {
    return "file:" + file;
  }
}
