package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Response with a list of incidents. */
public class IncidentsResponse extends AbstractModel {
  @RequiredProperty
  @Json(name = "data")
  private List<IncidentResponseData> data;

  @Json(name = "included")
  private List<Object> included;

  @Json(name = "meta")
  private IncidentResponseMeta meta;

  public IncidentsResponse() {}

  public IncidentsResponse(List<IncidentResponseData> data) {
    this.data = data;
  }

  public IncidentsResponse data(List<IncidentResponseData> data) {
    this.data = data;
    return this;
  }

  public IncidentsResponse addDataItem(IncidentResponseData dataItem) {
    if (this.data == null) {
      this.data = new ArrayList<>();
    }
    this.data.add(dataItem);
    return this;
  }

  /** An array of incidents. */
  public List<IncidentResponseData> getData() {
    return data;
  }

  public void setData(List<IncidentResponseData> data) {
    this.data = data;
  }

  public IncidentsResponse included(List<Object> included) {
    this.included = included;
    return this;
  }

  public IncidentsResponse addIncludedItem(Object includedItem) {
    if (this.included == null) {
      this.included = new ArrayList<>();
    }
    this.included.add(includedItem);
    return this;
  }

  /** Included related resources that the user requested. */
  @Nullable
  public List<Object> getIncluded() {
    return included;
  }

  public boolean hasIncluded() {
    return included != null;
  }

  public void setIncluded(List<Object> included) {
    this.included = included;
  }

  public IncidentsResponse meta(IncidentResponseMeta meta) {
    this.meta = meta;
    return this;
  }

  @Nullable
  public IncidentResponseMeta getMeta() {
    return meta;
  }

  public boolean hasMeta() {
    return meta != null;
  }

  public void setMeta(IncidentResponseMeta meta) {
    this.meta = meta;
  }
}
