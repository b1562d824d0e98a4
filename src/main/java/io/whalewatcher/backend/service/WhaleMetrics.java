package io.whalewatcher.backend.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.whalewatcher.backend.config.WhaleProperties;
import io.whalewatcher.backend.model.TransferCategory;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class WhaleMetrics {
  private final MeterRegistry meterRegistry;
  private final WhaleProperties whaleProperties;

  public WhaleMetrics(MeterRegistry meterRegistry, WhaleProperties whaleProperties) {
    this.meterRegistry = meterRegistry;
    this.whaleProperties = whaleProperties;
  }

  public void providerFailure(TransferCategory category) {
    if (!whaleProperties.isMetricsEnabled()) return;
    meterRegistry
        .counter("whales.provider.failure", "category", category.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  public void cacheHit() {
    if (!whaleProperties.isMetricsEnabled()) return;
    meterRegistry.counter("whales.cache.hit").increment();
  }

  public void cacheRefresh(boolean succeeded) {
    if (!whaleProperties.isMetricsEnabled()) return;
    meterRegistry
        .counter("whales.cache.refresh", "outcome", succeeded ? "success" : "failure")
        .increment();
  }

  public void llmFallback(String operation) {
    if (!whaleProperties.isMetricsEnabled()) return;
    meterRegistry.counter("whales.llm.fallback", "operation", operation).increment();
  }
}
