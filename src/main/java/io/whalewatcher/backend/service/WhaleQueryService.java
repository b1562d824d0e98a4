package io.whalewatcher.backend.service;

import io.whalewatcher.backend.config.WhaleProperties;
import io.whalewatcher.backend.model.TransferRecord;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for reading whale transfers.
 *
 * <p>The caller's threshold is applied twice: once by the fetch cycle that warms the cache, and again
 * over the cached snapshot, because that snapshot may have been fetched for a different caller with a
 * lower threshold.
 */
@Service
public class WhaleQueryService {
  private static final Logger log = LoggerFactory.getLogger(WhaleQueryService.class);

  private final SnapshotCache cache;
  private final WhaleFetchPipeline pipeline;
  private final WhaleMetrics metrics;
  private final int maxLimit;

  public WhaleQueryService(
      SnapshotCache cache,
      WhaleFetchPipeline pipeline,
      WhaleMetrics metrics,
      WhaleProperties properties) {
    this.cache = cache;
    this.pipeline = pipeline;
    this.metrics = metrics;
    this.maxLimit = Math.max(1, properties.getMaxLimit());
  }

  /**
   * Returns at most {@code limit} tracked transfers with amount at least {@code minAmount}, newest
   * block first. Provider and parse failures degrade the result; they never surface as exceptions.
   */
  public List<TransferRecord> fetchWhales(int limit, double minAmount) {
    int cycleLimit = clampLimit(limit);
    // Nothing to return, and refreshing with a zero limit would cache an empty snapshot.
    if (cycleLimit == 0) return List.of();
    double threshold = normalizeMinAmount(minAmount);
    // No amount reaches +Infinity; a cycle at that threshold would cache an empty snapshot.
    if (threshold == Double.POSITIVE_INFINITY) return List.of();

    AtomicBoolean refreshed = new AtomicBoolean(false);
    Optional<SnapshotCache.Snapshot> snapshot;
    try {
      snapshot =
          cache.getOrRefresh(
              cycleLimit,
              threshold,
              () -> {
                refreshed.set(true);
                Optional<List<TransferRecord>> loaded = pipeline.runCycle(threshold, cycleLimit);
                metrics.cacheRefresh(loaded.isPresent());
                return loaded;
              });
    } catch (RuntimeException e) {
      log.warn("whale fetch failed: limit={} minAmount={}", limit, minAmount, e);
      return List.of();
    }
    if (!refreshed.get()) metrics.cacheHit();

    return snapshot
        .map(
            s ->
                s.records().stream()
                    .filter(r -> r.amount() >= threshold)
                    .limit(cycleLimit)
                    .toList())
        .orElse(List.of());
  }

  int clampLimit(int limit) {
    if (limit < 0) return 0;
    return Math.min(limit, maxLimit);
  }

  /** NaN and negative thresholds mean "no threshold"; +Infinity is kept and matches nothing. */
  static double normalizeMinAmount(double minAmount) {
    if (Double.isNaN(minAmount) || minAmount < 0d) return 0d;
    return minAmount;
  }
}
