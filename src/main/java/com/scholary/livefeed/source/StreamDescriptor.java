package com.scholary.livefeed.source;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Configuration of one camera stream, as held by the external configuration store.
 *
 * <p>The id doubles as a directory name and a chunk file prefix, so it is restricted to letters,
 * digits, underscore and dash.
 */
public record StreamDescriptor(
    String id, String name, StreamSource source, boolean desiredActive) {

  private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

  public StreamDescriptor {
    if (id == null || !ID_PATTERN.matcher(id).matches()) {
      throw new IllegalArgumentException("Invalid stream id: " + id);
    }
    Objects.requireNonNull(source, "source");
    if (name == null || name.isBlank()) {
      name = "Stream " + id;
    }
  }

  public StreamDescriptor withDesiredActive(boolean desired) {
    return new StreamDescriptor(id, name, source, desired);
  }
}
