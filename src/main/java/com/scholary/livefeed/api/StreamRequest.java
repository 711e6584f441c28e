package com.scholary.livefeed.api;

import com.scholary.livefeed.source.LoopedFileSource;
import com.scholary.livefeed.source.NetworkFeedSource;
import com.scholary.livefeed.source.SourceKind;
import com.scholary.livefeed.source.StreamDescriptor;
import com.scholary.livefeed.source.StreamSource;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.nio.file.Paths;

/**
 * Request to register or replace a stream in the catalog.
 *
 * <p>A {@code LOOPED_FILE} source needs {@code file}; a {@code NETWORK_FEED} source needs {@code
 * transport} and {@code uri}.
 */
public record StreamRequest(
    String name,
    @NotNull SourceKind kind,
    String file,
    NetworkFeedSource.Transport transport,
    String uri,
    Boolean desiredActive) {

  /**
   * Build the descriptor for a stream id.
   *
   * @throws IllegalArgumentException if the source fields do not match the kind
   */
  public StreamDescriptor toDescriptor(String id) {
    return new StreamDescriptor(id, name, toSource(), Boolean.TRUE.equals(desiredActive));
  }

  private StreamSource toSource() {
    if (kind == SourceKind.LOOPED_FILE) {
      if (file == null || file.isBlank()) {
        throw new IllegalArgumentException("file is required for a looped file source");
      }
      return new LoopedFileSource(Paths.get(file));
    }
    if (transport == null || uri == null || uri.isBlank()) {
      throw new IllegalArgumentException("transport and uri are required for a network feed");
    }
    return new NetworkFeedSource(transport, URI.create(uri));
  }
}
