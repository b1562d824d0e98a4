package io.whalewatcher.backend.service;

import io.whalewatcher.backend.config.WhaleProperties;
import io.whalewatcher.backend.model.TransferRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Single-slot cache holding the latest fetch cycle's transfers.
 *
 * <p>The slot starts {@link State#COLD} and becomes {@link State#WARM} after the first successful
 * cycle, even an empty one. A snapshot younger than the TTL is returned as is; otherwise the caller
 * runs a new cycle while holding the lock, so concurrent stale readers wait for one refresh instead
 * of each starting their own. A failed cycle leaves the previous snapshot in place, and it keeps
 * being served past its TTL until a cycle succeeds.
 *
 * <p>Ages are measured with a monotonic clock; the wall-clock {@code fetchedAt} is for reporting only.
 */
@Component
public class SnapshotCache {
  private static final Logger log = LoggerFactory.getLogger(SnapshotCache.class);

  public enum State {
    COLD,
    WARM
  }

  /** One fetch cycle's result, with the limit and threshold that cycle ran with. */
  public record Snapshot(
      List<TransferRecord> records,
      long fetchedAtNanos,
      Instant fetchedAt,
      int fetchLimit,
      double minAmount) {
    public Snapshot {
      records = List.copyOf(records);
    }
  }

  private final ReentrantLock lock = new ReentrantLock();
  private final long ttlNanos;
  private final LongSupplier nanoTime;
  private final Clock clock;

  private volatile Snapshot current;

  @Autowired
  public SnapshotCache(WhaleProperties properties, Clock clock) {
    this(Duration.ofSeconds(Math.max(0L, properties.getCacheTtlSeconds())), System::nanoTime, clock);
  }

  SnapshotCache(Duration ttl, LongSupplier nanoTime, Clock clock) {
    this.ttlNanos = ttl.toNanos();
    this.nanoTime = nanoTime;
    this.clock = clock;
  }

  /**
   * Returns the fresh snapshot, refreshing it through {@code loader} when missing or expired. The
   * loader returns empty when the cycle failed. The result is empty only while the cache is cold
   * and the refresh failed. {@code fetchLimit} and {@code minAmount} are the parameters the loader
   * runs with; they are stored on the snapshot it produces.
   */
  public Optional<Snapshot> getOrRefresh(
      int fetchLimit, double minAmount, Supplier<Optional<List<TransferRecord>>> loader) {
    Snapshot snapshot = current;
    if (isFresh(snapshot)) return Optional.of(snapshot);

    lock.lock();
    try {
      snapshot = current;
      if (isFresh(snapshot)) return Optional.of(snapshot);

      long started = nanoTime.getAsLong();
      Optional<List<TransferRecord>> loaded = loader.get();
      if (loaded.isEmpty()) {
        log.warn(
            "snapshot refresh failed, keeping previous: state={} ageMs={}",
            snapshot == null ? State.COLD : State.WARM,
            snapshot == null ? null : Duration.ofNanos(started - snapshot.fetchedAtNanos()).toMillis());
        return Optional.ofNullable(snapshot);
      }

      long fetchedAtNanos = nanoTime.getAsLong();
      Snapshot replacement =
          new Snapshot(loaded.get(), fetchedAtNanos, clock.instant(), fetchLimit, minAmount);
      current = replacement;
      log.info(
          "snapshot replaced: records={} fetchLimit={} minAmount={} elapsedMs={}",
          replacement.records().size(),
          fetchLimit,
          minAmount,
          Duration.ofNanos(fetchedAtNanos - started).toMillis());
      return Optional.of(replacement);
    } finally {
      lock.unlock();
    }
  }

  public Optional<Snapshot> current() {
    return Optional.ofNullable(current);
  }

  public State state() {
    return current == null ? State.COLD : State.WARM;
  }

  /** Age of the current snapshot on the monotonic clock, empty while cold. */
  public Optional<Duration> age() {
    Snapshot snapshot = current;
    if (snapshot == null) return Optional.empty();
    return Optional.of(Duration.ofNanos(nanoTime.getAsLong() - snapshot.fetchedAtNanos()));
  }

  public Duration ttl() {
    return Duration.ofNanos(ttlNanos);
  }

  private boolean isFresh(Snapshot snapshot) {
    return snapshot != null && nanoTime.getAsLong() - snapshot.fetchedAtNanos() < ttlNanos;
  }
}
