package io.whalewatcher.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.alchemy")
public class AlchemyProperties {
  private String apiKey = "";
  private String baseUrl = "https://eth-mainnet.g.alchemy.com/v2";
  private long timeoutMs = 10_000;
  private int maxCountPerCategory = 500;

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

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public int getMaxCountPerCategory() {
    return maxCountPerCategory;
  }

  public void setMaxCountPerCategory(int maxCountPerCategory) {
    this.maxCountPerCategory = maxCountPerCategory;
  }
}
