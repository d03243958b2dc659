package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** The request for a security signal list. */
public class SecurityMonitoringSignalListRequest extends AbstractModel {
  @Json(name = "filter")
  private SecurityMonitoringSignalListRequestFilter filter;

  @Json(name = "page")
  private SecurityMonitoringSignalListRequestPage page;

  @Json(name = "sort")
  private SecurityMonitoringSignalsSort sort;

  public SecurityMonitoringSignalListRequest() {}

  public SecurityMonitoringSignalListRequest filter(
      SecurityMonitoringSignalListRequestFilter filter) {
    this.filter = filter;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalListRequestFilter getFilter() {
    return filter;
  }

  public boolean hasFilter() {
    return filter != null;
  }

  public void setFilter(SecurityMonitoringSignalListRequestFilter filter) {
    this.filter = filter;
  }

  public SecurityMonitoringSignalListRequest page(SecurityMonitoringSignalListRequestPage page) {
    this.page = page;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalListRequestPage getPage() {
    return page;
  }

  public boolean hasPage() {
    return page != null;
  }

  public void setPage(SecurityMonitoringSignalListRequestPage page) {
    this.page = page;
  }

  public SecurityMonitoringSignalListRequest sort(SecurityMonitoringSignalsSort sort) {
    this.sort = sort;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalsSort getSort() {
    return sort;
  }

  public boolean hasSort() {
    return sort != null;
  }

  public void setSort(SecurityMonitoringSignalsSort sort) {
    this.sort = sort;
  }
}
