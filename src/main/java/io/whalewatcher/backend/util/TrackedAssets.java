package io.whalewatcher.backend.util;

import java.util.Set;

public final class TrackedAssets {
  private TrackedAssets() {}

  public static final String NATIVE_SYMBOL = "ETH";

  // Reported when a token transfer carries no symbol.
  public static final String UNKNOWN_SYMBOL = "UNKNOWN";

  public static final Set<String> SYMBOLS = Set.of(NATIVE_SYMBOL, "USDC", "USDT", "WBTC");

  public static boolean isTracked(String symbol) {
    return symbol != null && SYMBOLS.contains(symbol);
  }
}
