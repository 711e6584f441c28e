package com.scholary.livefeed.supervisor;

/** Why a stream is being restarted. Each cause treats the restart counter differently. */
public enum RestartCause {
  /** The transcoder died on its own. Counts against the restart cap. */
  CRASH,
  /** The playlist went stale while the process was up. Leaves the counter alone. */
  HEALTH,
  /** A stream that should be running is down. Resets the counter to zero. */
  RECOVERY,
  /** Requested by an operator. Clears manual stop and resets the counter. */
  OPERATOR
}
