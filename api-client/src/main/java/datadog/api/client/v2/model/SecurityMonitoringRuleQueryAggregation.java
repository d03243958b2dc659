package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The aggregation type. */
public enum SecurityMonitoringRuleQueryAggregation {
  @Json(name = "count")
  COUNT("count"),

  @Json(name = "cardinality")
  CARDINALITY("cardinality"),

  @Json(name = "sum")
  SUM("sum"),

  @Json(name = "max")
  MAX("max"),

  @Json(name = "new_value")
  NEW_VALUE("new_value"),

  @Json(name = "geo_data")
  GEO_DATA("geo_data"),

  @Json(name = "event_count")
  EVENT_COUNT("event_count"),

  @Json(name = "none")
  NONE("none");

  private final String value;

  SecurityMonitoringRuleQueryAggregation(String value) {
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
  public static SecurityMonitoringRuleQueryAggregation fromValue(String value) {
    for (SecurityMonitoringRuleQueryAggregation candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for SecurityMonitoringRuleQueryAggregation");
  }
}
