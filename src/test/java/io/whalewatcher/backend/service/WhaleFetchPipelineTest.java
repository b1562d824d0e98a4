package io.whalewatcher.backend.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.whalewatcher.backend.client.AlchemyTransfersClient;
import io.whalewatcher.backend.client.CategoryFetchResult;
import io.whalewatcher.backend.config.WhaleProperties;
import io.whalewatcher.backend.model.RawTransfer;
import io.whalewatcher.backend.model.TransferCategory;
import io.whalewatcher.backend.model.TransferRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WhaleFetchPipelineTest {
  private AlchemyTransfersClient client;
  private SimpleMeterRegistry registry;
  private WhaleFetchPipeline pipeline;

  @BeforeEach
  void setUp() {
    client = mock(AlchemyTransfersClient.class);
    registry = new SimpleMeterRegistry();
    TransferNormalizer normalizer =
        new TransferNormalizer(Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));
    pipeline =
        new WhaleFetchPipeline(client, normalizer, new WhaleMetrics(registry, new WhaleProperties()));
  }

  @Test
  void tokenFailureStillReturnsNativeTransfers() {
    when(client.fetchAll(anyList()))
        .thenReturn(
            List.of(
                CategoryFetchResult.success(
                    TransferCategory.NATIVE,
                    List.of(new RawTransfer("0x1", "0xA", "0xB", "150", "ETH", "0x64", null))),
                CategoryFetchResult.failure(TransferCategory.TOKEN, "http status 503")));

    List<TransferRecord> out = pipeline.runCycle(100, 20).orElseThrow();

    assertEquals(1, out.size());
    assertEquals("ETH", out.get(0).assetSymbol());
    assertEquals(
        1.0, registry.counter("whales.provider.failure", "category", "token").count());
  }

  @Test
  void cycleFailsOnlyWhenEveryCategoryFails() {
    when(client.fetchAll(anyList()))
        .thenReturn(
            List.of(
                CategoryFetchResult.failure(TransferCategory.NATIVE, "timeout"),
                CategoryFetchResult.failure(TransferCategory.TOKEN, "timeout")));

    assertTrue(pipeline.runCycle(100, 20).isEmpty());
  }

  @Test
  void emptyProviderResponsesAreASuccessfulEmptyCycle() {
    when(client.fetchAll(anyList()))
        .thenReturn(
            List.of(
                CategoryFetchResult.success(TransferCategory.NATIVE, List.of()),
                CategoryFetchResult.success(TransferCategory.TOKEN, List.of())));

    assertEquals(List.of(), pipeline.runCycle(100, 20).orElseThrow());
  }

  @Test
  void ordersByBlockDescendingKeepingInputOrderForTiesAndTruncates() {
    when(client.fetchAll(anyList()))
        .thenReturn(
            List.of(
                CategoryFetchResult.success(
                    TransferCategory.NATIVE,
                    List.of(
                        new RawTransfer("n1", "a", "b", "200", "ETH", "0x10", null),
                        new RawTransfer("n2", "a", "b", "200", "ETH", null, null),
                        new RawTransfer("n3", "a", "b", "200", "ETH", "0x20", null))),
                CategoryFetchResult.success(
                    TransferCategory.TOKEN,
                    List.of(
                        new RawTransfer("t1", "a", "b", "900000", "USDT", "0x20", "0xT"),
                        new RawTransfer("t2", "a", "b", "900000", "PEPE", "0x30", "0xP"),
                        new RawTransfer("t3", "a", "b", "50", "USDC", "0x40", "0xU"),
                        new RawTransfer("t4", "a", "b", "900000", "USDC", "0x5", "0xU")))));

    List<TransferRecord> all = pipeline.runCycle(100, 100).orElseThrow();
    assertEquals(
        List.of("n3", "t1", "n1", "t4", "n2"), all.stream().map(TransferRecord::txHash).toList());

    List<TransferRecord> truncated = pipeline.runCycle(100, 2).orElseThrow();
    assertEquals(List.of("n3", "t1"), truncated.stream().map(TransferRecord::txHash).toList());
  }

  @Test
  void queriesNativeThenToken() {
    assertEquals(
        List.of(TransferCategory.NATIVE, TransferCategory.TOKEN), WhaleFetchPipeline.CATEGORIES);
  }
}
