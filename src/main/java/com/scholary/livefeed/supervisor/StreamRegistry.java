package com.scholary.livefeed.supervisor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Registry of supervised streams on this instance.
 *
 * <p>Reads are lock-free. Admission is synchronized so the capacity check and the insert happen
 * as one step.
 */
@Component
class StreamRegistry {

  private final Map<String, StreamRuntimeState> states = new ConcurrentHashMap<>();

  /**
   * Admit a new stream.
   *
   * @throws StreamAlreadyExistsException if a state is already registered under the id
   * @throws StreamCapacityException if {@code maxStreams} states are already registered
   */
  synchronized void admit(StreamRuntimeState state, int maxStreams) {
    if (states.containsKey(state.id())) {
      throw new StreamAlreadyExistsException("Stream " + state.id() + " is already running");
    }
    if (states.size() >= maxStreams) {
      throw new StreamCapacityException(
          String.format("Maximum number of streams (%d) reached", maxStreams));
    }
    states.put(state.id(), state);
  }

  Optional<StreamRuntimeState> get(String id) {
    return Optional.ofNullable(states.get(id));
  }

  /** Remove the state only if it is still the one registered under its id. */
  boolean remove(StreamRuntimeState state) {
    return states.remove(state.id(), state);
  }

  boolean isCurrent(StreamRuntimeState state) {
    return states.get(state.id()) == state;
  }

  List<StreamRuntimeState> all() {
    return new ArrayList<>(states.values());
  }
}
