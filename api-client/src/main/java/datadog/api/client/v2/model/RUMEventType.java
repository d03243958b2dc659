package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Type of the event. */
public enum RUMEventType {
  @Json(name = "rum")
  RUM("rum");

  private final String value;

  RUMEventType(String value) {
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
  public static RUMEventType fromValue(String value) {
    for (RUMEventType candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unexpected value '" + value + "' for RUMEventType");
  }
}
