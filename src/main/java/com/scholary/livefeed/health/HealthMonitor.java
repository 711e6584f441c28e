package com.scholary.livefeed.health;

import com.scholary.livefeed.source.StreamCatalog;
import com.scholary.livefeed.source.StreamDescriptor;
import com.scholary.livefeed.supervisor.ProcessSupervisor;
import com.scholary.livefeed.supervisor.RestartCause;
import com.scholary.livefeed.supervisor.StreamSnapshot;
import com.scholary.livefeed.supervisor.StreamStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Periodic health check of every supervised stream.
 *
 * <p>Each round, for streams that were not stopped by an operator:
 *
 * <ul>
 *   <li>STOPPED or ERROR while the catalog says the stream should run: restart with the
 *       counter reset, which revives streams that used up their crash restarts
 *   <li>ACTIVE with a stale or empty playlist: restart, whatever the counter says
 * </ul>
 *
 * <p>A failure on one stream is logged and the round moves on to the next.
 */
@Component
public class HealthMonitor {

  private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

  private final ProcessSupervisor supervisor;
  private final StreamCatalog catalog;
  private final PlaylistInspector inspector;
  private final HealthProperties properties;
  private final TaskScheduler scheduler;
  private final Clock clock;

  private ScheduledFuture<?> task;

  public HealthMonitor(
      ProcessSupervisor supervisor,
      StreamCatalog catalog,
      PlaylistInspector inspector,
      HealthProperties properties,
      @Qualifier("controlScheduler") TaskScheduler scheduler,
      Clock clock) {
    this.supervisor = supervisor;
    this.catalog = catalog;
    this.inspector = inspector;
    this.properties = properties;
    this.scheduler = scheduler;
    this.clock = clock;
  }

  @PostConstruct
  public void schedule() {
    task =
        scheduler.scheduleAtFixedRate(
            this::runHealthCheck,
            clock.instant().plus(properties.checkInterval()),
            properties.checkInterval());
    LOGGER.info("Health checks every {}s", properties.checkInterval().getSeconds());
  }

  @PreDestroy
  public void cancel() {
    if (task != null) {
      task.cancel(false);
    }
  }

  /** Run one round of checks. Returns the number of restarts it requested. */
  public int runHealthCheck() {
    int restarts = 0;
    for (StreamSnapshot stream : supervisor.list()) {
      if (stream.manuallyStopped()) {
        continue;
      }
      try {
        if (check(stream)) {
          restarts++;
        }
      } catch (RuntimeException e) {
        LOGGER.error("Health check failed for stream {}", stream.id(), e);
      }
    }
    if (restarts > 0) {
      LOGGER.info("Health check restarted {} streams", restarts);
    }
    return restarts;
  }

  /** Inspect the playlist of a supervised stream. */
  public Optional<StreamHealth> inspect(String streamId) {
    return supervisor.playlistPath(streamId).map(inspector::inspect);
  }

  private boolean check(StreamSnapshot stream) {
    if (stream.status() == StreamStatus.STOPPED || stream.status() == StreamStatus.ERROR) {
      Optional<StreamDescriptor> descriptor;
      try {
        descriptor = catalog.find(stream.id());
      } catch (RuntimeException e) {
        LOGGER.warn(
            "Catalog lookup failed for stream {}, skipping: {}", stream.id(), e.getMessage());
        return false;
      }
      if (descriptor.isPresent() && descriptor.get().desiredActive()) {
        LOGGER.warn(
            "Stream {} is {} but should be running, restarting", stream.id(), stream.status());
        supervisor.restart(stream.id(), RestartCause.RECOVERY);
        return true;
      }
      return false;
    }

    if (stream.status() == StreamStatus.ACTIVE) {
      Optional<StreamHealth> health = inspect(stream.id());
      if (health.isPresent() && !health.get().healthy()) {
        LOGGER.warn("Stream {} is unhealthy ({}), restarting", stream.id(), health.get().reason());
        supervisor.restart(stream.id(), RestartCause.HEALTH);
        return true;
      }
    }
    return false;
  }
}
