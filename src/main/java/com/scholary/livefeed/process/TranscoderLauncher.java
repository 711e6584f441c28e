package com.scholary.livefeed.process;

import java.io.IOException;
import java.util.List;

/** Starts ffmpeg subprocesses. */
public interface TranscoderLauncher {

  /**
   * Launch a subprocess.
   *
   * @param command the full command line, binary first
   * @param label short name used for log lines and thread names (stream id or chunk id)
   * @return a handle on the running process
   * @throws IOException if the process cannot be spawned
   */
  TranscoderProcess launch(List<String> command, String label) throws IOException;
}
