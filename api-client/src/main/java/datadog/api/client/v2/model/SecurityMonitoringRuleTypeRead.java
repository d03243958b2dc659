package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The type of the detection rule. */
public enum SecurityMonitoringRuleTypeRead {
  @Json(name = "log_detection")
  LOG_DETECTION("log_detection"),

  @Json(name = "infrastructure_configuration")
  INFRASTRUCTURE_CONFIGURATION("infrastructure_configuration"),

  @Json(name = "workload_security")
  WORKLOAD_SECURITY("workload_security"),

  @Json(name = "cloud_configuration")
  CLOUD_CONFIGURATION("cloud_configuration"),

  @Json(name = "application_security")
  APPLICATION_SECURITY("application_security");

  private final String value;

  SecurityMonitoringRuleTypeRead(String value) {
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
  public static SecurityMonitoringRuleTypeRead fromValue(String value) {
    for (SecurityMonitoringRuleTypeRead candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringRuleTypeRead");
  }
}
