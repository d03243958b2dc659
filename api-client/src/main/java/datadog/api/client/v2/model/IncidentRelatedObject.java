package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Object related to an incident. */
public enum IncidentRelatedObject {
  @Json(name = "users")
  USERS("users"),

  @Json(name = "attachments")
  ATTACHMENTS("attachments");

  private final String value;

  IncidentRelatedObject(String value) {
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
  public static IncidentRelatedObject fromValue(String value) {
    for (IncidentRelatedObject candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        "Unexpected value '" + value + "' for IncidentRelatedObject");
  }
}
