package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The status of the response */
public enum LogsAggregateResponseStatus {
  @Json(name = "done")
  DONE("done"),

  @Json(name = "timeout")
  TIMEOUT("timeout");

  private final String value;

  LogsAggregateResponseStatus(String value) {
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
  public static LogsAggregateResponseStatus fromValue(String value) {
    for (LogsAggregateResponseStatus candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for LogsAggregateResponseStatus");
  }
}
