package com.scholary.livefeed.process;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on one running ffmpeg subprocess.
 *
 * <p>{@link #exit()} always returns the same future, completed exactly once with the exit code.
 * Callers react to process death through it and never poll.
 */
public interface TranscoderProcess {

  long pid();

  boolean isAlive();

  /** Future completed with the exit code once the process has terminated. */
  CompletableFuture<Integer> exit();

  /** Ask the process to stop (SIGTERM). */
  void terminate();

  /** Force the process to stop (SIGKILL). */
  void kill();

  /** The last few hundred characters the process wrote, for error reports. */
  String outputTail();
}
