package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** The paging attributes for listing security signals. */
public class SecurityMonitoringSignalListRequestPage extends AbstractModel {
  @Json(name = "cursor")
  private String cursor;

  @Json(name = "limit")
  private Integer limit = 10;

  public SecurityMonitoringSignalListRequestPage() {}

  public SecurityMonitoringSignalListRequestPage cursor(String cursor) {
    this.cursor = cursor;
    return this;
  }

  /** A list of results using the cursor provided in the previous query. */
  @Nullable
  public String getCursor() {
    return cursor;
  }

  public boolean hasCursor() {
    return cursor != null;
  }

  public void setCursor(String cursor) {
    this.cursor = cursor;
  }

  public SecurityMonitoringSignalListRequestPage limit(Integer limit) {
    this.limit = limit;
    return this;
  }

  /** The maximum number of security signals in the response. */
  @Nullable
  public Integer getLimit() {
    return limit;
  }

  public boolean hasLimit() {
    return limit != null;
  }

  public void setLimit(Integer limit) {
    this.limit = limit;
  }
}
