package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** Specifies storage type as indexes or online-archives */
public enum LogsStorageTier {
  @Json(name = "indexes")
  INDEXES("indexes"),

  @Json(name = "online-archives")
  ONLINE_ARCHIVES("online-archives");

  private final String value;

  LogsStorageTier(String value) {
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
  public static LogsStorageTier fromValue(String value) {
    for (LogsStorageTier candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unexpected value '" + value + "' for LogsStorageTier");
  }
}
