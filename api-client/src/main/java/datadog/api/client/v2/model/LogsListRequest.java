package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** The request for a logs list. */
public class LogsListRequest extends AbstractModel {
  @Json(name = "filter")
  private LogsQueryFilter filter;

  @Json(name = "options")
  private LogsQueryOptions options;

  @Json(name = "page")
  private LogsListRequestPage page;

  @Json(name = "sort")
  private LogsSort sort;

  public LogsListRequest() {}

  public LogsListRequest filter(LogsQueryFilter filter) {
    this.filter = filter;
    return this;
  }

  @Nullable
  public LogsQueryFilter getFilter() {
    return filter;
  }

  public boolean hasFilter() {
    return filter != null;
  }

  public void setFilter(LogsQueryFilter filter) {
    this.filter = filter;
  }

  public LogsListRequest options(LogsQueryOptions options) {
    this.options = options;
    return this;
  }

  @Nullable
  public LogsQueryOptions getOptions() {
    return options;
  }

  public boolean hasOptions() {
    return options != null;
  }

  public void setOptions(LogsQueryOptions options) {
    this.options = options;
  }

  public LogsListRequest page(LogsListRequestPage page) {
    this.page = page;
    return this;
  }

  @Nullable
  public LogsListRequestPage getPage() {
    return page;
  }

  public boolean hasPage() {
    return page != null;
  }

  public void setPage(LogsListRequestPage page) {
    this.page = page;
  }

  public LogsListRequest sort(LogsSort sort) {
    this.sort = sort;
    return this;
  }

  @Nullable
  public LogsSort getSort() {
    return sort;
  }

  public boolean hasSort() {
    return sort != null;
  }

  public void setSort(LogsSort sort) {
    this.sort = sort;
  }
}
