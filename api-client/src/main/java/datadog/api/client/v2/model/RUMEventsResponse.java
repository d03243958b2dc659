package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Response object with all events matching the request and pagination information. */
public class RUMEventsResponse extends AbstractModel {
  @Json(name = "data")
  private List<RUMEvent> data;

  @Json(name = "links")
  private RUMResponseLinks links;

  @Json(name = "meta")
  private RUMResponseMetadata meta;

  public RUMEventsResponse() {}

  public RUMEventsResponse data(List<RUMEvent> data) {
    this.data = data;
    return this;
  }

  public RUMEventsResponse addDataItem(RUMEvent dataItem) {
    if (this.data == null) {
      this.data = new ArrayList<>();
    }
    this.data.add(dataItem);
    return this;
  }

  /** Array of events matching the request. */
  @Nullable
  public List<RUMEvent> getData() {
    return data;
  }

  public boolean hasData() {
    return data != null;
  }

  public void setData(List<RUMEvent> data) {
    this.data = data;
  }

  public RUMEventsResponse links(RUMResponseLinks links) {
    this.links = links;
    return this;
  }

  @Nullable
  public RUMResponseLinks getLinks() {
    return links;
  }

  public boolean hasLinks() {
    return links != null;
  }

  public void setLinks(RUMResponseLinks links) {
    this.links = links;
  }

  public RUMEventsResponse meta(RUMResponseMetadata meta) {
    this.meta = meta;
    return this;
  }

  @Nullable
  public RUMResponseMetadata getMeta() {
    return meta;
  }

  public boolean hasMeta() {
    return meta != null;
  }

  public void setMeta(RUMResponseMetadata meta) {
    this.meta = meta;
  }
}
