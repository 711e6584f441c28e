package com.scholary.livefeed.source;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

/**
 * In-memory stream catalog.
 *
 * <p>Good enough for a single instance. Stream records live in the database of the
 * administration service in production; swap this bean for a client of that service there.
 */
@Repository
public class InMemoryStreamCatalog implements StreamCatalog {

  private final ConcurrentMap<String, StreamDescriptor> descriptors = new ConcurrentHashMap<>();

  @Override
  public Optional<StreamDescriptor> find(String id) {
    return Optional.ofNullable(descriptors.get(id));
  }

  @Override
  public List<StreamDescriptor> findAll() {
    List<StreamDescriptor> all = new ArrayList<>(descriptors.values());
    all.sort(Comparator.comparing(StreamDescriptor::id));
    return all;
  }

  @Override
  public StreamDescriptor save(StreamDescriptor descriptor) {
    descriptors.put(descriptor.id(), descriptor);
    return descriptor;
  }

  @Override
  public Optional<StreamDescriptor> setDesiredActive(String id, boolean desiredActive) {
    return Optional.ofNullable(
        descriptors.computeIfPresent(
            id, (key, current) -> current.withDesiredActive(desiredActive)));
  }
}
