package io.whalewatcher.backend.model;

public enum TransferCategory {
  NATIVE("external"),
  TOKEN("erc20");

  private final String providerName;

  TransferCategory(String providerName) {
    this.providerName = providerName;
  }

  /** Category name understood by alchemy_getAssetTransfers. */
  public String providerName() {
    return providerName;
  }
}
