package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/**
 * Global query options that are used during the query. Note: you should supply either timezone or
 * time offset, but not both. Otherwise, the query will fail.
 */
public class LogsQueryOptions extends AbstractModel {
  @Json(name = "timeOffset")
  private Long timeOffset;

  @Json(name = "timezone")
  private String timezone = "UTC";

  public LogsQueryOptions() {}

  public LogsQueryOptions timeOffset(Long timeOffset) {
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

  public LogsQueryOptions timezone(String timezone) {
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
