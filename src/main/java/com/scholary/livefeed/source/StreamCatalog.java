package com.scholary.livefeed.source;

import java.util.List;
import java.util.Optional;

/**
 * Store of configured streams and whether each should be running.
 *
 * <p>Implementations may be remote; lookups can fail with a runtime exception.
 */
public interface StreamCatalog {

  Optional<StreamDescriptor> find(String id);

  List<StreamDescriptor> findAll();

  /** Insert or replace the descriptor with the same id. */
  StreamDescriptor save(StreamDescriptor descriptor);

  /**
   * Update the desired-active flag of a stream.
   *
   * @return the updated descriptor, or empty if no stream has this id
   */
  Optional<StreamDescriptor> setDesiredActive(String id, boolean desiredActive);
}
