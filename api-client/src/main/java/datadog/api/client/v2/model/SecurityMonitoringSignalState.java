package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The new triage state of the signal. */
public enum SecurityMonitoringSignalState {
  @Json(name = "open")
  OPEN("open"),

  @Json(name = "archived")
  ARCHIVED("archived"),

  @Json(name = "under_review")
  UNDER_REVIEW("under_review");

  private final String value;

  SecurityMonitoringSignalState(String value) {
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
  public static SecurityMonitoringSignalState fromValue(String value) {
    for (SecurityMonitoringSignalState candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringSignalState");
  }
}
