package datadog.api.client.v2.model;

import com.squareup.moshi.Json;

/** HTTP header used to compress the media-type. */
public enum ContentEncoding {
  @Json(name = "gzip")
  GZIP("gzip"),

  @Json(name = "deflate")
  DEFLATE("deflate");

  private final String value;

  ContentEncoding(String value) {
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
  public static ContentEncoding fromValue(String value) {
    for (ContentEncoding candidate : values()) {
      if (candidate.value.equals(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unexpected value '" + value + "' for ContentEncoding");
  }
}
