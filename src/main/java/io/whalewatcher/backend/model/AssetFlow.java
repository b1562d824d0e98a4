package io.whalewatcher.backend.model;

public record AssetFlow(String symbol, int count, double totalVolume, double maxAmount) {}
