package io.whalewatcher.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.whalewatcher.backend.config.LlmProperties;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Minimal client for an OpenAI-compatible {@code /chat/completions} endpoint. */
@Component
public class OpenAiChatClient {
  private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

  private final WebClient webClient;
  private final String apiKey;
  private final String model;
  private final String baseUrl;
  private final Duration timeout;

  public OpenAiChatClient(WebClient webClient, LlmProperties properties) {
    this.webClient = webClient;
    this.apiKey = properties.getApiKey() == null ? "" : properties.getApiKey().trim();
    this.model = properties.getModel() == null ? "" : properties.getModel().trim();
    this.baseUrl =
        (properties.getBaseUrl() == null ? "" : properties.getBaseUrl().trim())
            .replaceAll("/+$", "");
    this.timeout = Duration.ofMillis(Math.max(1000L, properties.getTimeoutMs()));
  }

  public boolean isEnabled() {
    return !apiKey.isBlank() && !baseUrl.isBlank() && !model.isBlank();
  }

  /** Returns the assistant's reply, or empty when disabled or the call fails. */
  public Optional<String> complete(String systemPrompt, String userPrompt, double temperature) {
    if (!isEnabled()) {
      if (log.isDebugEnabled()) {
        log.debug("chat completion skipped: apiKeyBlank={} model='{}'", apiKey.isBlank(), model);
      }
      return Optional.empty();
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", model);
    body.put(
        "messages",
        List.of(
            Map.of("role", "system", "content", systemPrompt),
            Map.of("role", "user", "content", userPrompt)));
    body.put("temperature", temperature);

    URI uri = URI.create(baseUrl + "/chat/completions");
    try {
      JsonNode root =
          webClient
              .post()
              .uri(uri)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
              .bodyValue(body)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout)
              .block();
      if (root == null) {
        log.warn("chat completion returned null body model='{}'", model);
        return Optional.empty();
      }
      JsonNode content = root.path("choices").path(0).path("message").path("content");
      if (!content.isTextual() || content.asText().isBlank()) {
        log.warn("chat completion missing choices[0].message.content model='{}'", model);
        return Optional.empty();
      }
      return Optional.of(content.asText().trim());
    } catch (Exception e) {
      log.warn("chat completion request failed model='{}' uri={}", model, uri, e);
      return Optional.empty();
    }
  }
}
