package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The response object with all security signals matching the request and pagination information.
 */
public class SecurityMonitoringSignalsListResponse extends AbstractModel {
  @Json(name = "data")
  private List<SecurityMonitoringSignal> data;

  @Json(name = "links")
  private SecurityMonitoringSignalsListResponseLinks links;

  @Json(name = "meta")
  private SecurityMonitoringSignalsListResponseMeta meta;

  public SecurityMonitoringSignalsListResponse() {}

  public SecurityMonitoringSignalsListResponse data(List<SecurityMonitoringSignal> data) {
    this.data = data;
    return this;
  }

  public SecurityMonitoringSignalsListResponse addDataItem(SecurityMonitoringSignal dataItem) {
    if (this.data == null) {
      this.data = new ArrayList<>();
    }
    this.data.add(dataItem);
    return this;
  }

  /** An array of security signals matching the request. */
  @Nullable
  public List<SecurityMonitoringSignal> getData() {
    return data;
  }

  public boolean hasData() {
    return data != null;
  }

  public void setData(List<SecurityMonitoringSignal> data) {
    this.data = data;
  }

  public SecurityMonitoringSignalsListResponse links(
      SecurityMonitoringSignalsListResponseLinks links) {
    this.links = links;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalsListResponseLinks getLinks() {
    return links;
  }

  public boolean hasLinks() {
    return links != null;
  }

  public void setLinks(SecurityMonitoringSignalsListResponseLinks links) {
    this.links = links;
  }

  public SecurityMonitoringSignalsListResponse meta(
      SecurityMonitoringSignalsListResponseMeta meta) {
    this.meta = meta;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalsListResponseMeta getMeta() {
    return meta;
  }

  public boolean hasMeta() {
    return meta != null;
  }

  public void setMeta(SecurityMonitoringSignalsListResponseMeta meta) {
    this.meta = meta;
  }
}
