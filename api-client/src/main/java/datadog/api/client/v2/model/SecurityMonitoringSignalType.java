package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The type of event. */
public enum SecurityMonitoringSignalType {
  @Json(name = "signal")
  SIGNAL("signal");

  private final String value;

  SecurityMonitoringSignalType(String value) {
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
  public static SecurityMonitoringSignalType fromValue(String value) {
    for (SecurityMonitoringSignalType candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringSignalType");
  }
}
