package io.whalewatcher.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** OpenAI-compatible chat completion settings. A blank key disables LLM commentary. */
@Component
@ConfigurationProperties(prefix = "app.llm")
public class LlmProperties {
  private String apiKey = "";
  private String baseUrl = "https://api.openai.com/v1";
  private String model = "gpt-4.1-mini";
  private long timeoutMs = 30_000;

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }
}
