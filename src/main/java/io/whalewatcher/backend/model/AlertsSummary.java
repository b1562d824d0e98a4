package io.whalewatcher.backend.model;

public record AlertsSummary(String summary, int transferCount) {}
