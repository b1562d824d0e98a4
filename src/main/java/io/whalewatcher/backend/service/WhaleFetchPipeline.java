package io.whalewatcher.backend.service;

import io.whalewatcher.backend.client.AlchemyTransfersClient;
import io.whalewatcher.backend.client.CategoryFetchResult;
import io.whalewatcher.backend.model.RawTransfer;
import io.whalewatcher.backend.model.TransferCategory;
import io.whalewatcher.backend.model.TransferRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One fetch cycle: query every category, normalize and filter, order newest block first, truncate.
 *
 * <p>A category that fails contributes nothing. The cycle itself fails (empty Optional) only when
 * no category succeeded; an all-successful cycle with zero accepted transfers yields an empty list.
 */
@Service
public class WhaleFetchPipeline {
  private static final Logger log = LoggerFactory.getLogger(WhaleFetchPipeline.class);

  static final List<TransferCategory> CATEGORIES =
      List.of(TransferCategory.NATIVE, TransferCategory.TOKEN);

  private static final Comparator<TransferRecord> NEWEST_BLOCK_FIRST =
      Comparator.comparingLong(TransferRecord::blockNumber).reversed();

  private final AlchemyTransfersClient client;
  private final TransferNormalizer normalizer;
  private final WhaleMetrics metrics;

  public WhaleFetchPipeline(
      AlchemyTransfersClient client, TransferNormalizer normalizer, WhaleMetrics metrics) {
    this.client = client;
    this.normalizer = normalizer;
    this.metrics = metrics;
  }

  public Optional<List<TransferRecord>> runCycle(double minAmount, int limit) {
    List<CategoryFetchResult> results = client.fetchAll(CATEGORIES);

    boolean anySuccess = false;
    int received = 0;
    List<TransferRecord> accepted = new ArrayList<>();
    for (CategoryFetchResult result : results) {
      if (!result.isSuccess()) {
        log.warn(
            "provider fetch failed: category={} reason={}",
            result.category(),
            result.failureReason());
        metrics.providerFailure(result.category());
        continue;
      }
      anySuccess = true;
      for (RawTransfer raw : result.transfers()) {
        received++;
        normalizer.normalize(raw, minAmount).ifPresent(accepted::add);
      }
    }
    if (!anySuccess) return Optional.empty();

    // List.sort is stable, so ties keep native-then-token provider order.
    accepted.sort(NEWEST_BLOCK_FIRST);
    int max = Math.max(0, limit);
    List<TransferRecord> out = accepted.size() > max ? accepted.subList(0, max) : accepted;
    if (log.isDebugEnabled()) {
      log.debug(
          "fetch cycle done: received={} accepted={} returned={} minAmount={} limit={}",
          received,
          accepted.size(),
          out.size(),
          minAmount,
          limit);
    }
    return Optional.of(List.copyOf(out));
  }
}
