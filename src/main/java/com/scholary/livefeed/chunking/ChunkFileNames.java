package com.scholary.livefeed.chunking;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Naming scheme of chunk files: {@code <streamId>_<chunkId>_<offsetSeconds>.mp4}. */
public final class ChunkFileNames {

  public static final String EXTENSION = ".mp4";

  // stream ids may contain underscores, chunk ids are UUIDs
  private static final Pattern NAME =
      Pattern.compile("^(.+)_([0-9a-fA-F]{8}-[0-9a-fA-F-]{27})_(\\d+)\\.mp4$");

  private ChunkFileNames() {}

  public static String fileName(String streamId, String chunkId, long offsetSeconds) {
    return streamId + "_" + chunkId + "_" + offsetSeconds + EXTENSION;
  }

  /** Parse a chunk file name, or return empty if the name does not follow the scheme. */
  public static Optional<ParsedName> parse(String fileName) {
    Matcher matcher = NAME.matcher(fileName);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(
        new ParsedName(matcher.group(1), matcher.group(2), Long.parseLong(matcher.group(3))));
  }

  public record ParsedName(String streamId, String chunkId, long offsetSeconds) {}
}
