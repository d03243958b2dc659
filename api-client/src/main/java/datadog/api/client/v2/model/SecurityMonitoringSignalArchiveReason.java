package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Reason a signal is archived. */
public enum SecurityMonitoringSignalArchiveReason {
  @Json(name = "none")
  NONE("none"),

  @Json(name = "false_positive")
  FALSE_POSITIVE("false_positive"),

  @Json(name = "testing_or_maintenance")
  TESTING_OR_MAINTENANCE("testing_or_maintenance"),

  @Json(name = "other")
  OTHER("other");

  private final String value;

  SecurityMonitoringSignalArchiveReason(String value) {
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
  public static SecurityMonitoringSignalArchiveReason fromValue(String value) {
    for (SecurityMonitoringSignalArchiveReason candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringSignalArchiveReason");
  }
}
