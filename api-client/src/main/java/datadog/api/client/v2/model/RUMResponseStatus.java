package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** The status of the response. */
public enum RUMResponseStatus {
  @Json(name = "done")
  DONE("done"),

  @Json(name = "timeout")
  TIMEOUT("timeout");

  private final String value;

  RUMResponseStatus(String value) {
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
  public static RUMResponseStatus fromValue(String value) {
    for (RUMResponseStatus candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unexpected value '" + value + "' for RUMResponseStatus");
  }
}
