package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Paging attributes for listing events. */
public class RUMQueryPageOptions extends AbstractModel {
  @Json(name = "cursor")
  private String cursor;

  @Json(name = "limit")
  private Integer limit = 10;

  public RUMQueryPageOptions() {}

  public RUMQueryPageOptions cursor(String cursor) {
    this.cursor = cursor;
    return this;
  }

  /** List following results with a cursor provided in the previous query. */
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

  public RUMQueryPageOptions limit(Integer limit) {
    this.limit = limit;
    return this;
  }

  /** Maximum number of events in the response. */
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
