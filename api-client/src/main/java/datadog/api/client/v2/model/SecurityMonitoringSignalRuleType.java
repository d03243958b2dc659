package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The rule type. */
public enum SecurityMonitoringSignalRuleType {
  @Json(name = "signal_correlation")
  SIGNAL_CORRELATION("signal_correlation");

  private final String value;

  SecurityMonitoringSignalRuleType(String value) {
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
  public static SecurityMonitoringSignalRuleType fromValue(String value) {
    for (SecurityMonitoringSignalRuleType candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringSignalRuleType");
  }
}
