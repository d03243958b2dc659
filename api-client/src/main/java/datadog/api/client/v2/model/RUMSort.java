package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Sort parameters when querying events. */
public enum RUMSort {
  @Json(name = "timestamp")
  TIMESTAMP_ASCENDING("timestamp"),

  @Json(name = "-timestamp")
  TIMESTAMP_DESCENDING("-timestamp");

  private final String value;

  RUMSort(String value) {
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
  public static RUMSort fromValue(String value) {
    for (RUMSort candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unexpected value '" + value + "' for RUMSort");
  }
}
