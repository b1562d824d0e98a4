package io.whalewatcher.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.whalewatcher.backend.config.AlchemyProperties;
import io.whalewatcher.backend.config.ConfigurationException;
import io.whalewatcher.backend.model.RawTransfer;
import io.whalewatcher.backend.model.TransferCategory;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.web3j.utils.Numeric;

/**
 * Reads recent asset transfers from Alchemy's {@code alchemy_getAssetTransfers} JSON-RPC method.
 *
 * <p>Each category is queried on its own, newest first, with zero-value transfers excluded. Failures
 * come back as {@link CategoryFetchResult#failure}; deciding what to log or count is left to the
 * caller.
 */
@Component
public class AlchemyTransfersClient {
  static final String METHOD = "alchemy_getAssetTransfers";

  private final WebClient webClient;
  private final URI endpoint;
  private final Duration timeout;
  private final String maxCountHex;

  public AlchemyTransfersClient(WebClient webClient, AlchemyProperties properties) {
    String apiKey = properties.getApiKey() == null ? "" : properties.getApiKey().trim();
    if (apiKey.isBlank()) {
      throw new ConfigurationException(
          "app.alchemy.api-key", "ALCHEMY_API_KEY is missing; whale transfers cannot be fetched");
    }
    String baseUrl = properties.getBaseUrl() == null ? "" : properties.getBaseUrl().trim();
    if (baseUrl.isBlank()) {
      throw new ConfigurationException("app.alchemy.base-url", "app.alchemy.base-url is blank");
    }
    this.webClient = webClient;
    this.endpoint = URI.create(baseUrl.replaceAll("/+$", "") + "/" + apiKey);
    this.timeout = Duration.ofMillis(Math.max(1000L, properties.getTimeoutMs()));
    int maxCount = Math.max(1, properties.getMaxCountPerCategory());
    this.maxCountHex = Numeric.toHexStringWithPrefix(BigInteger.valueOf(maxCount));
  }

  public List<CategoryFetchResult> fetchAll(List<TransferCategory> categories) {
    List<CategoryFetchResult> out = new ArrayList<>();
    for (TransferCategory category : categories) {
      out.add(fetchCategory(category));
    }
    return out;
  }

  public CategoryFetchResult fetchCategory(TransferCategory category) {
    JsonNode root;
    try {
      root =
          webClient
              .post()
              .uri(endpoint)
              .bodyValue(requestBody(category))
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout)
              .block();
    } catch (WebClientResponseException e) {
      return CategoryFetchResult.failure(category, "http status " + e.getStatusCode().value());
    } catch (Exception e) {
      return CategoryFetchResult.failure(category, describe(e));
    }

    if (root == null || !root.isObject()) {
      return CategoryFetchResult.failure(category, "empty or non-object response body");
    }
    JsonNode error = root.path("error");
    if (!error.isMissingNode() && !error.isNull()) {
      return CategoryFetchResult.failure(
          category, "rpc error: " + error.path("message").asText(error.toString()));
    }
    JsonNode transfers = root.path("result").path("transfers");
    if (!transfers.isArray()) {
      return CategoryFetchResult.failure(category, "response has no result.transfers array");
    }

    List<RawTransfer> out = new ArrayList<>(transfers.size());
    for (JsonNode item : transfers) {
      if (item == null || !item.isObject()) continue;
      out.add(toRawTransfer(item));
    }
    return CategoryFetchResult.success(category, out);
  }

  Map<String, Object> requestBody(TransferCategory category) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("fromBlock", "0x0");
    params.put("toBlock", "latest");
    params.put("category", List.of(category.providerName()));
    params.put("withMetadata", true);
    params.put("excludeZeroValue", true);
    params.put("maxCount", maxCountHex);
    params.put("order", "desc");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("jsonrpc", "2.0");
    body.put("id", 1);
    body.put("method", METHOD);
    body.put("params", List.of(params));
    return body;
  }

  private static RawTransfer toRawTransfer(JsonNode item) {
    return new RawTransfer(
        text(item.path("hash")),
        text(item.path("from")),
        text(item.path("to")),
        valueText(item.path("value")),
        text(item.path("asset")),
        text(item.path("blockNum")),
        text(item.path("rawContract").path("address")));
  }

  // Alchemy sends value as a JSON number; keep its textual form so parsing stays in one place.
  private static String valueText(JsonNode node) {
    if (node.isNumber() || node.isTextual()) return node.asText();
    return null;
  }

  private static String text(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) return null;
    String v = node.asText(null);
    return (v == null || v.isBlank()) ? null : v.trim();
  }

  private static String describe(Throwable e) {
    Throwable root = e;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String message = root.getMessage();
    return root.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }
}
