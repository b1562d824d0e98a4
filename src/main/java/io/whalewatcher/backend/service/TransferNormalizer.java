package io.whalewatcher.backend.service;

import io.whalewatcher.backend.model.RawTransfer;
import io.whalewatcher.backend.model.TransferRecord;
import io.whalewatcher.backend.util.TrackedAssets;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one provider record into a {@link TransferRecord}, or rejects it.
 *
 * <p>Checks run in a fixed order and stop at the first rejection: value present and numeric, amount
 * positive and at least {@code minAmount}, asset tracked. A missing or unparsable block number is
 * not a rejection; it becomes block 0.
 */
@Component
public class TransferNormalizer {
  private static final Logger log = LoggerFactory.getLogger(TransferNormalizer.class);

  private final Clock clock;

  public TransferNormalizer(Clock clock) {
    this.clock = clock;
  }

  public Optional<TransferRecord> normalize(RawTransfer raw, double minAmount) {
    if (raw == null) return Optional.empty();

    String value = normalizeBlankToNull(raw.value());
    if (value == null) return reject(raw, "missing value");

    double amount;
    try {
      amount = Double.parseDouble(value);
    } catch (NumberFormatException e) {
      return reject(raw, "non-numeric value");
    }
    if (!Double.isFinite(amount) || amount <= 0d) return reject(raw, "zero or invalid amount");
    if (amount < minAmount) return reject(raw, "below threshold");

    String contract = normalizeBlankToNull(raw.contractAddress());
    String symbol = resolveSymbol(contract, raw.asset());
    if (!TrackedAssets.isTracked(symbol)) return reject(raw, "untracked asset " + symbol);

    return Optional.of(
        new TransferRecord(
            nullToEmpty(raw.hash()),
            nullToEmpty(raw.from()),
            nullToEmpty(raw.to()),
            symbol,
            contract,
            amount,
            parseBlockNumber(raw.blockNum()),
            TransferRecord.CHAIN,
            clock.instant()));
  }

  static String resolveSymbol(String contract, String asset) {
    if (contract == null) return TrackedAssets.NATIVE_SYMBOL;
    String s = normalizeBlankToNull(asset);
    return s == null ? TrackedAssets.UNKNOWN_SYMBOL : s.toUpperCase(Locale.ROOT);
  }

  static long parseBlockNumber(String blockNum) {
    String s = normalizeBlankToNull(blockNum);
    if (s == null) return 0L;
    if (s.startsWith("0x") || s.startsWith("0X")) s = s.substring(2);
    if (s.isEmpty()) return 0L;
    try {
      BigInteger v = new BigInteger(s, 16);
      return (v.signum() < 0 || v.bitLength() > 63) ? 0L : v.longValue();
    } catch (NumberFormatException e) {
      return 0L;
    }
  }

  private static Optional<TransferRecord> reject(RawTransfer raw, String reason) {
    if (log.isDebugEnabled()) {
      log.debug("transfer rejected: hash={} reason={}", raw.hash(), reason);
    }
    return Optional.empty();
  }

  private static String normalizeBlankToNull(String value) {
    String v = value == null ? null : value.trim();
    return (v == null || v.isBlank()) ? null : v;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
