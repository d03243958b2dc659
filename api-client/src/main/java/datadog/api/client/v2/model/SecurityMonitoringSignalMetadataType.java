package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The type of event. */
public enum SecurityMonitoringSignalMetadataType {
  @Json(name = "signal_metadata")
  SIGNAL_METADATA("signal_metadata");

  private final String value;

  SecurityMonitoringSignalMetadataType(String value) {
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
  public static SecurityMonitoringSignalMetadataType fromValue(String value) {
    for (SecurityMonitoringSignalMetadataType candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringSignalMetadataType");
  }
}
