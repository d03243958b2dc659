package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Severity of the Security Signal. */
public enum SecurityMonitoringRuleSeverity {
  @Json(name = "info")
  INFO("info"),

  @Json(name = "low")
  LOW("low"),

  @Json(name = "medium")
  MEDIUM("medium"),

  @Json(name = "high")
  HIGH("high"),

  @Json(name = "critical")
  CRITICAL("critical");

  private final String value;

  SecurityMonitoringRuleSeverity(String value) {
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
  public static SecurityMonitoringRuleSeverity fromValue(String value) {
    for (SecurityMonitoringRuleSeverity candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringRuleSeverity");
  }
}
