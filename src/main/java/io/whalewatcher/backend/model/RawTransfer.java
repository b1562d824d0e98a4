package io.whalewatcher.backend.model;

/** One transfer as reported by the provider, before any parsing or filtering. */
public record RawTransfer(
    String hash,
    String from,
    String to,
    String value,
    String asset,
    String blockNum,
    String contractAddress) {}
