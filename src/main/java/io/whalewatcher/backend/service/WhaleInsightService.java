package io.whalewatcher.backend.service;

import io.whalewatcher.backend.client.OpenAiChatClient;
import io.whalewatcher.backend.model.AlertsSummary;
import io.whalewatcher.backend.model.AssetFlow;
import io.whalewatcher.backend.model.ChatResponse;
import io.whalewatcher.backend.model.TransferRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * LLM commentary over the current whale transfers.
 *
 * <p>Transfers come from {@link WhaleQueryService}; this class only builds prompts. When the LLM is
 * disabled or fails, a plain digest of per-asset flows is returned instead.
 */
@Service
public class WhaleInsightService {
  static final String NO_TRANSFERS_SUMMARY =
      "No recent whale transfers were found, so there is nothing to analyze right now.";
  static final String NO_TRANSFERS_ANSWER =
      "Right now I don't see any whale transfers, so there isn't enough data to answer that question.";

  private static final String SUMMARY_SYSTEM_PROMPT =
      "You are an on-chain crypto analyst helping a user understand a whale-monitoring dashboard. "
          + "The dashboard lists large Ethereum transfers of ETH, USDC, USDT and WBTC. "
          + "You look at these transfers and suggest possible explanations. "
          + "Be precise, avoid overconfidence, and mention uncertainty when you don't know.";

  private static final String CHAT_SYSTEM_PROMPT =
      "You are an on-chain crypto analyst. "
          + "You look at large Ethereum transfers and answer questions about possible explanations. "
          + "Be precise, avoid overconfidence, and mention uncertainty when you don't know.";

  private final WhaleQueryService whales;
  private final OpenAiChatClient llm;
  private final WhaleMetrics metrics;

  public WhaleInsightService(WhaleQueryService whales, OpenAiChatClient llm, WhaleMetrics metrics) {
    this.whales = whales;
    this.llm = llm;
    this.metrics = metrics;
  }

  public AlertsSummary summarize(int limit, double minAmount) {
    List<TransferRecord> transfers = whales.fetchWhales(limit, minAmount);
    if (transfers.isEmpty()) {
      return new AlertsSummary(NO_TRANSFERS_SUMMARY, 0);
    }

    List<AssetFlow> flows = aggregateByAsset(transfers);
    String userPrompt =
        "Here are recent large transfers on Ethereum:\n\n"
            + describeTransfers(transfers)
            + "\n\nTotals per asset:\n"
            + describeFlows(flows)
            + "\n\nIn 3-5 sentences, explain what might be going on. "
            + "Mention whether this looks like internal movements, exchange inflows/outflows, OTC trades, "
            + "or accumulation by a large wallet. If you are not sure, say so.";

    Optional<String> answer = llm.complete(SUMMARY_SYSTEM_PROMPT, userPrompt, 0.4);
    if (answer.isEmpty()) metrics.llmFallback("summary");
    String summary = answer.orElseGet(() -> digest(transfers.size(), flows));
    return new AlertsSummary(summary, transfers.size());
  }

  public ChatResponse chat(String question, int limit, double minAmount) {
    List<TransferRecord> transfers = whales.fetchWhales(limit, minAmount);
    if (transfers.isEmpty()) {
      return new ChatResponse(NO_TRANSFERS_ANSWER, 0);
    }

    String userPrompt =
        "Here are recent large transfers:\n\n"
            + describeTransfers(transfers)
            + "\n\nThe user asks: "
            + question.trim()
            + "\n\nAnswer in 3-6 sentences. Base your answer strictly on the flows above and common "
            + "on-chain patterns. If something is speculative, say that it is only a possibility.";

    Optional<String> answer = llm.complete(CHAT_SYSTEM_PROMPT, userPrompt, 0.5);
    if (answer.isEmpty()) metrics.llmFallback("chat");
    String text =
        answer.orElseGet(
            () ->
                "The analyst model is unavailable, so here are the raw figures instead. "
                    + digest(transfers.size(), aggregateByAsset(transfers)));
    return new ChatResponse(text, transfers.size());
  }

  /** Per-asset count, volume and largest amount, highest volume first. */
  public static List<AssetFlow> aggregateByAsset(List<TransferRecord> transfers) {
    Map<String, double[]> acc = new LinkedHashMap<>();
    for (TransferRecord t : transfers) {
      // [count, totalVolume, maxAmount]
      double[] a = acc.computeIfAbsent(t.assetSymbol(), k -> new double[3]);
      a[0] += 1;
      a[1] += t.amount();
      a[2] = Math.max(a[2], t.amount());
    }
    List<AssetFlow> out = new ArrayList<>();
    acc.forEach((symbol, a) -> out.add(new AssetFlow(symbol, (int) a[0], a[1], a[2])));
    out.sort(
        Comparator.comparingDouble(AssetFlow::totalVolume)
            .reversed()
            .thenComparing(AssetFlow::symbol));
    return out;
  }

  static String describeTransfers(List<TransferRecord> transfers) {
    List<String> lines = new ArrayList<>();
    for (TransferRecord t : transfers) {
      lines.add(
          "- "
              + formatAmount(t.amount())
              + " "
              + t.assetSymbol()
              + " from "
              + shortAddress(t.fromAddress())
              + " to "
              + shortAddress(t.toAddress())
              + " (block "
              + t.blockNumber()
              + ")");
    }
    return String.join("\n", lines);
  }

  static String describeFlows(List<AssetFlow> flows) {
    List<String> lines = new ArrayList<>();
    for (AssetFlow f : flows) {
      lines.add(
          "- "
              + f.symbol()
              + ": "
              + f.count()
              + " transfers, total "
              + formatAmount(f.totalVolume())
              + ", largest "
              + formatAmount(f.maxAmount()));
    }
    return String.join("\n", lines);
  }

  static String shortAddress(String address) {
    if (address == null || address.isBlank()) return "unknown";
    String a = address.trim();
    if (a.length() <= 10) return a;
    return a.substring(0, 6) + "..." + a.substring(a.length() - 4);
  }

  static String formatAmount(double amount) {
    BigDecimal v = BigDecimal.valueOf(amount).stripTrailingZeros();
    if (v.scale() > 4) v = v.setScale(4, RoundingMode.HALF_UP).stripTrailingZeros();
    return v.toPlainString();
  }

  private static String digest(int transferCount, List<AssetFlow> flows) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            Locale.ROOT, "%d whale transfers across %d assets.", transferCount, flows.size()));
    for (AssetFlow f : flows) {
      sb.append(' ')
          .append(f.symbol())
          .append(": ")
          .append(f.count())
          .append(f.count() == 1 ? " transfer" : " transfers")
          .append(", total ")
          .append(formatAmount(f.totalVolume()))
          .append(", largest ")
          .append(formatAmount(f.maxAmount()))
          .append('.');
    }
    return sb.toString();
  }
}
