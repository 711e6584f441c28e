package com.scholary.livefeed.source;

/**
 * Where a stream's video comes from.
 *
 * <p>Implementations validate their kind-specific fields at construction, so a source that
 * exists is always launchable as far as its own configuration goes.
 */
public interface StreamSource {

  SourceKind kind();

  /**
   * Human-readable description safe for logs and API responses.
   *
   * @return the source description with any credentials removed
   */
  String describe();
}
