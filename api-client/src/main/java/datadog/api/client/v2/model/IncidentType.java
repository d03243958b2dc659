package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Incident resource type. */
public enum IncidentType {
  @Json(name = "incidents")
  INCIDENTS("incidents");

  private final String value;

  IncidentType(String value) {
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
  public static IncidentType fromValue(String value) {
    for (IncidentType candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unexpected value '" + value + "' for IncidentType");
  }
}
