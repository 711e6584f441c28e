package com.scholary.livefeed.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Launches ffmpeg through {@link ProcessBuilder}.
 *
 * <p>ffmpeg logs everything to stderr. We merge it into stdout and drain it on a daemon thread:
 * an undrained pipe fills up and blocks the encoder. Progress lines ({@code frame=},
 * {@code time=}) are dropped, everything else goes to debug and into a short tail kept for
 * error reports.
 */
@Component
public class SystemTranscoderLauncher implements TranscoderLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(SystemTranscoderLauncher.class);

  private static final int TAIL_CHARS = 1000;

  @Override
  public TranscoderProcess launch(List<String> command, String label) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);

    Process process = pb.start();
    OutputTail tail = new OutputTail(TAIL_CHARS);

    Thread drainer = new Thread(() -> drain(process, tail, label), "ffmpeg-out-" + label);
    drainer.setDaemon(true);
    drainer.start();

    return new SystemTranscoderProcess(process, tail);
  }

  private void drain(Process process, OutputTail tail, String label) {
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8), 8192)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.contains("frame=") || line.contains("time=")) {
          continue;
        }
        tail.append(line);
        LOGGER.debug("ffmpeg[{}]: {}", label, line);
      }
    } catch (IOException e) {
      // stream closes when the process is killed
      LOGGER.trace("Output of ffmpeg[{}] closed: {}", label, e.getMessage());
    }
  }

  private static final class SystemTranscoderProcess implements TranscoderProcess {

    private final Process process;
    private final OutputTail tail;
    private final CompletableFuture<Integer> exit;

    private SystemTranscoderProcess(Process process, OutputTail tail) {
      this.process = process;
      this.tail = tail;
      this.exit = process.onExit().thenApply(Process::exitValue);
    }

    @Override
    public long pid() {
      return process.pid();
    }

    @Override
    public boolean isAlive() {
      return process.isAlive();
    }

    @Override
    public CompletableFuture<Integer> exit() {
      return exit;
    }

    @Override
    public void terminate() {
      process.destroy();
    }

    @Override
    public void kill() {
      process.destroyForcibly();
    }

    @Override
    public String outputTail() {
      return tail.snapshot();
    }
  }
}
