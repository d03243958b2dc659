package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The sort parameters used for querying security signals. */
public enum SecurityMonitoringSignalsSort {
  @Json(name = "timestamp")
  TIMESTAMP_ASCENDING("timestamp"),

  @Json(name = "-timestamp")
  TIMESTAMP_DESCENDING("-timestamp");

  private final String value;

  SecurityMonitoringSignalsSort(String value) {
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
  public static SecurityMonitoringSignalsSort fromValue(String value) {
    for (SecurityMonitoringSignalsSort candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringSignalsSort");
  }
}
