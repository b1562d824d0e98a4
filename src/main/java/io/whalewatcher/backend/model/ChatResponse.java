package io.whalewatcher.backend.model;

public record ChatResponse(String answer, int transferCount) {}
