package io.whalewatcher.backend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.whalewatcher.backend.client.OpenAiChatClient;
import io.whalewatcher.backend.config.WhaleProperties;
import io.whalewatcher.backend.model.AlertsSummary;
import io.whalewatcher.backend.model.AssetFlow;
import io.whalewatcher.backend.model.ChatResponse;
import io.whalewatcher.backend.model.TransferRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class WhaleInsightServiceTest {
  private static final List<TransferRecord> TRANSFERS =
      List.of(
          transfer("0x1", "ETH", null, 450.0, 20),
          transfer("0x2", "USDT", "0xdac1", 2_000_000.0, 19),
          transfer("0x3", "ETH", null, 150.25, 18),
          transfer("0x4", "USDT", "0xdac1", 1_500_000.0, 17));

  private WhaleQueryService whales;
  private OpenAiChatClient llm;
  private SimpleMeterRegistry registry;
  private WhaleInsightService service;

  @BeforeEach
  void setUp() {
    whales = mock(WhaleQueryService.class);
    llm = mock(OpenAiChatClient.class);
    registry = new SimpleMeterRegistry();
    service =
        new WhaleInsightService(whales, llm, new WhaleMetrics(registry, new WhaleProperties()));
  }

  @Test
  void summaryWithoutTransfersSkipsLlm() {
    when(whales.fetchWhales(20, 100.0)).thenReturn(List.of());

    AlertsSummary summary = service.summarize(20, 100.0);

    assertEquals(WhaleInsightService.NO_TRANSFERS_SUMMARY, summary.summary());
    assertEquals(0, summary.transferCount());
    verify(llm, never()).complete(anyString(), anyString(), anyDouble());
  }

  @Test
  void summaryPromptListsTransfersAndFlows() {
    when(whales.fetchWhales(20, 100.0)).thenReturn(TRANSFERS);
    when(llm.complete(anyString(), anyString(), eq(0.4))).thenReturn(Optional.of("Exchange outflows."));

    AlertsSummary summary = service.summarize(20, 100.0);

    assertEquals("Exchange outflows.", summary.summary());
    assertEquals(4, summary.transferCount());
    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(llm).complete(anyString(), prompt.capture(), eq(0.4));
    assertThat(prompt.getValue())
        .contains("- 450 ETH from 0x1234...abcd to 0x9876...4321 (block 20)")
        .contains("- 2000000 USDT from")
        .contains("- USDT: 2 transfers, total 3500000, largest 2000000")
        .contains("- ETH: 2 transfers, total 600.25, largest 450");
  }

  @Test
  void summaryFallsBackToDigestWhenLlmUnavailable() {
    when(whales.fetchWhales(20, 100.0)).thenReturn(TRANSFERS);
    when(llm.complete(anyString(), anyString(), anyDouble())).thenReturn(Optional.empty());

    AlertsSummary summary = service.summarize(20, 100.0);

    assertThat(summary.summary())
        .startsWith("4 whale transfers across 2 assets.")
        .contains("USDT: 2 transfers, total 3500000, largest 2000000.");
    assertEquals(1.0, registry.counter("whales.llm.fallback", "operation", "summary").count());
  }

  @Test
  void chatIncludesQuestion() {
    when(whales.fetchWhales(10, 200.0)).thenReturn(TRANSFERS);
    when(llm.complete(anyString(), anyString(), eq(0.5))).thenReturn(Optional.of("Likely OTC."));

    ChatResponse response = service.chat("  Is this an exchange?  ", 10, 200.0);

    assertEquals("Likely OTC.", response.answer());
    assertEquals(4, response.transferCount());
    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(llm).complete(anyString(), prompt.capture(), eq(0.5));
    assertThat(prompt.getValue()).contains("The user asks: Is this an exchange?\n");
  }

  @Test
  void chatWithoutTransfersReturnsFixedAnswer() {
    when(whales.fetchWhales(20, 100.0)).thenReturn(List.of());

    ChatResponse response = service.chat("what happened?", 20, 100.0);

    assertEquals(WhaleInsightService.NO_TRANSFERS_ANSWER, response.answer());
    assertEquals(0, response.transferCount());
  }

  @Test
  void aggregatesPerAssetByVolume() {
    List<AssetFlow> flows = WhaleInsightService.aggregateByAsset(TRANSFERS);

    assertEquals(2, flows.size());
    assertEquals(new AssetFlow("USDT", 2, 3_500_000.0, 2_000_000.0), flows.get(0));
    assertEquals(new AssetFlow("ETH", 2, 600.25, 450.0), flows.get(1));
  }

  @Test
  void shortensAddressesAndAmounts() {
    assertEquals("0x1234...abcd", WhaleInsightService.shortAddress("0x1234567890abcd"));
    assertEquals("0xA", WhaleInsightService.shortAddress("0xA"));
    assertEquals("unknown", WhaleInsightService.shortAddress(null));
    assertEquals("1.2346", WhaleInsightService.formatAmount(1.23456789));
    assertEquals("100", WhaleInsightService.formatAmount(100.0));
  }

  private static TransferRecord transfer(
      String hash, String symbol, String contract, double amount, long block) {
    return new TransferRecord(
        hash,
        "0x1234567890abcd",
        "0x98765432104321",
        symbol,
        contract,
        amount,
        block,
        TransferRecord.CHAIN,
        Instant.EPOCH);
  }
}
