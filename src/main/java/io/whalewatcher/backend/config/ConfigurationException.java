package io.whalewatcher.backend.config;

/** A required setting is missing or unusable; the application cannot start without it. */
public class ConfigurationException extends RuntimeException {
  private final String property;

  public ConfigurationException(String property, String message) {
    super(message);
    this.property = property;
  }

  public String getProperty() {
    return property;
  }
}
