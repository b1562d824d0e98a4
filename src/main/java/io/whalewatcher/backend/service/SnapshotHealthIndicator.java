package io.whalewatcher.backend.service;

import java.time.Duration;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the snapshot cache under {@code /actuator/health}. A cold or stale cache is still UP: the
 * service answers with empty or older results rather than failing.
 */
@Component
public class SnapshotHealthIndicator implements HealthIndicator {
  private final SnapshotCache cache;

  public SnapshotHealthIndicator(SnapshotCache cache) {
    this.cache = cache;
  }

  @Override
  public Health health() {
    Health.Builder builder =
        Health.up()
            .withDetail("state", cache.state().name())
            .withDetail("ttlSeconds", cache.ttl().toSeconds());
    cache
        .current()
        .ifPresent(
            s -> {
              Duration age = cache.age().orElse(Duration.ZERO);
              builder
                  .withDetail("records", s.records().size())
                  .withDetail("fetchedAt", s.fetchedAt().toString())
                  .withDetail("fetchLimit", s.fetchLimit())
                  .withDetail("minAmount", s.minAmount())
                  .withDetail("ageSeconds", age.toSeconds())
                  .withDetail("stale", age.compareTo(cache.ttl()) >= 0);
            });
    return builder.build();
  }
}
