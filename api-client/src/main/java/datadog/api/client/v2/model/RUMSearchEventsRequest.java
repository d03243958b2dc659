package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** The request for a RUM events list. */
public class RUMSearchEventsRequest extends AbstractModel {
  @Json(name = "filter")
  private RUMQueryFilter filter;

  @Json(name = "options")
  private RUMQueryOptions options;

  @Json(name = "page")
  private RUMQueryPageOptions page;

  @Json(name = "sort")
  private RUMSort sort;

  public RUMSearchEventsRequest() {}

  public RUMSearchEventsRequest filter(RUMQueryFilter filter) {
    this.filter = filter;
    return this;
  }

  @Nullable
  public RUMQueryFilter getFilter() {
    return filter;
  }

  public boolean hasFilter() {
    return filter != null;
  }

  public void setFilter(RUMQueryFilter filter) {
    this.filter = filter;
  }

  public RUMSearchEventsRequest options(RUMQueryOptions options) {
    this.options = options;
    return this;
  }

  @Nullable
  public RUMQueryOptions getOptions() {
    return options;
  }

  public boolean hasOptions() {
    return options != null;
  }

  public void setOptions(RUMQueryOptions options) {
    this.options = options;
  }

  public RUMSearchEventsRequest page(RUMQueryPageOptions page) {
    this.page = page;
    return this;
  }

  @Nullable
  public RUMQueryPageOptions getPage() {
    return page;
  }

  public boolean hasPage() {
    return page != null;
  }

  public void setPage(RUMQueryPageOptions page) {
    this.page = page;
  }

  public RUMSearchEventsRequest sort(RUMSort sort) {
    this.sort = sort;
    return this;
  }

  @Nullable
  public RUMSort getSort() {
    return sort;
  }

  public boolean hasSort() {
    return sort != null;
  }

  public void setSort(RUMSort sort) {
    this.sort = sort;
  }
}
