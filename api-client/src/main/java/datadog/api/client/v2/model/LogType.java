package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Type of the event. */
public enum LogType {
  @Json(name = "log")
  LOG("log");

  private final String value;

  LogType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }

  /**
   * @throws IllegalArgumentException if {@code value} is not a known value.
   */
  public static LogType fromValue(String value) {
    for (LogType candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unexpected value '" + value + "' for LogType");
  }
}
