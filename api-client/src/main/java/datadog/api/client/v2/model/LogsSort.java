package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Sort parameters when querying logs. */
public enum LogsSort {
  @Json(name = "timestamp")
  TIMESTAMP_ASCENDING("timestamp"),

  @Json(name = "-timestamp")
  TIMESTAMP_DESCENDING("-timestamp");

  private final String value;

  LogsSort(String value) {
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
  public static LogsSort fromValue(String value) {
    for (LogsSort candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unexpected value '" + value + "' for LogsSort");
  }
}
