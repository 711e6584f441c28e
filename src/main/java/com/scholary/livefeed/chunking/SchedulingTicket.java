package com.scholary.livefeed.chunking;

import com.scholary.livefeed.source.SourceAdapter;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handle on one stream's periodic extraction.
 *
 * <p>Holds the next offset. Taking an offset advances it in the same atomic step, so offsets
 * never repeat and never go backwards, whatever happens to the extraction that uses them.
 * Cancelling is final.
 */
final class SchedulingTicket {

  private final String streamId;
  private final String locator;
  private final Instant startedAt;
  private final AtomicLong nextOffset;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicLong extracted = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  private volatile ScheduledFuture<?> future;
  private volatile ChunkDescriptor lastFailure;

  SchedulingTicket(String streamId, String locator, long seedOffset, Instant startedAt) {
    this.streamId = streamId;
    this.locator = locator;
    this.startedAt = startedAt;
    this.nextOffset = new AtomicLong(seedOffset);
  }

  String streamId() {
    return streamId;
  }

  String locator() {
    return locator;
  }

  /** Take the current offset and advance by {@code step}. */
  long takeOffset(int step) {
    return nextOffset.getAndAdd(step);
  }

  void attach(ScheduledFuture<?> future) {
    this.future = future;
    if (cancelled.get() && future != null) {
      future.cancel(false);
    }
  }

  /** Cancel the ticket. Returns false if it was already cancelled. */
  boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    ScheduledFuture<?> current = future;
    if (current != null) {
      current.cancel(false);
    }
    return true;
  }

  boolean isCancelled() {
    return cancelled.get();
  }

  void recordExtracted() {
    extracted.incrementAndGet();
  }

  void recordFailed() {
    failed.incrementAndGet();
  }

  void recordFailed(ChunkDescriptor chunk) {
    failed.incrementAndGet();
    lastFailure = chunk;
  }

  ScheduleSnapshot snapshot() {
    return new ScheduleSnapshot(
        streamId,
        redactedLocator(),
        nextOffset.get(),
        extracted.get(),
        failed.get(),
        startedAt,
        lastFailure);
  }

  private String redactedLocator() {
    return SourceAdapter.redact(locator);
  }
}
