package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Response object with all logs matching the request and pagination information. */
public class LogsListResponse extends AbstractModel {
  @Json(name = "data")
  private List<Log> data;

  @Json(name = "links")
  private LogsListResponseLinks links;

  @Json(name = "meta")
  private LogsResponseMetadata meta;

  public LogsListResponse() {}

  public LogsListResponse data(List<Log> data) {
    this.data = data;
    return this;
  }

  public LogsListResponse addDataItem(Log dataItem) {
    if (this.data == null) {
      this.data = new ArrayList<>();
    }
    this.data.add(dataItem);
    return this;
  }

  /** Array of logs matching the request. */
  @Nullable
  public List<Log> getData() {
    return data;
  }

  public boolean hasData() {
    return data != null;
  }

  public void setData(List<Log> data) {
    this.data = data;
  }

  public LogsListResponse links(LogsListResponseLinks links) {
    this.links = links;
    return this;
  }

  @Nullable
  public LogsListResponseLinks getLinks() {
    return links;
  }

  public boolean hasLinks() {
    return links != null;
  }

  public void setLinks(LogsListResponseLinks links) {
    this.links = links;
  }

  public LogsListResponse meta(LogsResponseMetadata meta) {
    this.meta = meta;
    return this;
  }

  @Nullable
  public LogsResponseMetadata getMeta() {
    return meta;
  }

  public boolean hasMeta() {
    return meta != null;
  }

  public void setMeta(LogsResponseMetadata meta) {
    this.meta = meta;
  }
}
