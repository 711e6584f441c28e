package com.scholary.livefeed.source;

import com.scholary.livefeed.supervisor.SupervisorProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lists the local video files that can back a looped-file stream.
 *
 * <p>Only the media root itself is scanned, not subdirectories.
 */
@Component
public class MediaLibrary {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaLibrary.class);

  private static final Set<String> SUPPORTED_EXTENSIONS =
      Set.of(".mp4", ".mov", ".avi", ".mkv", ".m4v");

  private final Path mediaRoot;

  public MediaLibrary(SupervisorProperties properties) {
    this.mediaRoot = Paths.get(properties.mediaRoot());
  }

  /** A video file found in the media root. */
  public record MediaFile(String filename, Path path, long sizeBytes, Instant lastModified) {}

  /**
   * Scan the media root.
   *
   * @return the supported video files, sorted by name; empty if the root does not exist
   * @throws IOException if the directory cannot be listed
   */
  public List<MediaFile> scan() throws IOException {
    if (!Files.isDirectory(mediaRoot)) {
      LOGGER.warn("Media root does not exist: {}", mediaRoot);
      return List.of();
    }

    List<MediaFile> files = new ArrayList<>();
    try (Stream<Path> entries = Files.list(mediaRoot)) {
      for (Path path : (Iterable<Path>) entries::iterator) {
        if (!Files.isRegularFile(path) || !isSupported(path)) {
          continue;
        }
        try {
          files.add(
              new MediaFile(
                  path.getFileName().toString(),
                  path,
                  Files.size(path),
                  Files.getLastModifiedTime(path).toInstant()));
        } catch (IOException e) {
          LOGGER.warn("Skipping unreadable media file {}: {}", path, e.getMessage());
        }
      }
    }
    files.sort(Comparator.comparing(MediaFile::filename));
    LOGGER.debug("Found {} media files in {}", files.size(), mediaRoot);
    return files;
  }

  static boolean isSupported(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    return dot >= 0 && SUPPORTED_EXTENSIONS.contains(name.substring(dot));
  }
}
