package com.scholary.livefeed.supervisor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a supervised stream.
 *
 * <p>Legal transitions:
 *
 * <ul>
 *   <li>STARTING → ACTIVE, ERROR, STOPPED
 *   <li>ACTIVE → STARTING (restart), ERROR, STOPPED
 *   <li>ERROR → STARTING, STOPPED
 *   <li>STOPPED → STARTING
 * </ul>
 */
public enum StreamStatus {
  STARTING,
  ACTIVE,
  ERROR,
  STOPPED;

  public boolean canTransitionTo(StreamStatus target) {
    return successors().contains(target);
  }

  private Set<StreamStatus> successors() {
    switch (this) {
      case STARTING:
        return EnumSet.of(ACTIVE, ERROR, STOPPED);
      case ACTIVE:
        return EnumSet.of(STARTING, ERROR, STOPPED);
      case ERROR:
        return EnumSet.of(STARTING, STOPPED);
      case STOPPED:
        return EnumSet.of(STARTING);
      default:
        throw new IllegalStateException("Unknown status: " + this);
    }
  }
}
