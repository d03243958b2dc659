package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/**
 * Global query options that are used during the query. Only supply timezone or time offset, not
 * both. Otherwise, the query fails.
 */
public class RUMQueryOptions extends AbstractModel {
  @Json(name = "time_offset")
  private Long timeOffset;

  @Json(name = "timezone")
  private String timezone = "UTC";

  public RUMQueryOptions() {}

  public RUMQueryOptions timeOffset(Long timeOffset) {
    this.timeOffset = timeOffset;
    return this;
  }

  /** The time offset (in seconds) to apply to the query. */
  @Nullable
  public Long getTimeOffset() {
    return timeOffset;
  }

  public boolean hasTimeOffset() {
    return timeOffset != null;
  }

  public void setTimeOffset(Long timeOffset) {
    this.timeOffset = timeOffset;
  }

  public RUMQueryOptions timezone(String timezone) {
    this.timezone = timezone;
    return this;
  }

  /** The timezone can be specified both as an offset, for example: "UTC+03:00". */
  @Nullable
  public String getTimezone() {
    return timezone;
  }

  public boolean hasTimezone() {
    return timezone != null;
  }

  public void setTimezone(String timezone) {
    this.timezone = timezone;
  }
}
