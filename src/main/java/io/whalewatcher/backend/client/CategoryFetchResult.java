package io.whalewatcher.backend.client;

import io.whalewatcher.backend.model.RawTransfer;
import io.whalewatcher.backend.model.TransferCategory;
import java.util.List;

/**
 * Outcome of one category query. A failure carries no transfers and a short reason suitable for
 * logging; it is never thrown.
 */
public record CategoryFetchResult(
    TransferCategory category, List<RawTransfer> transfers, String failureReason) {

  public static CategoryFetchResult success(TransferCategory category, List<RawTransfer> transfers) {
    return new CategoryFetchResult(category, List.copyOf(transfers), null);
  }

  public static CategoryFetchResult failure(TransferCategory category, String reason) {
    return new CategoryFetchResult(category, List.of(), reason == null ? "unknown" : reason);
  }

  public boolean isSuccess() {
    return failureReason == null;
  }
}
