package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Response with an incident. */
public class IncidentResponse extends AbstractModel {
  @RequiredProperty
  @Json(name = "data")
  private IncidentResponseData data;

  @Json(name = "included")
  private List<Object> included;

  public IncidentResponse() {}

  public IncidentResponse(IncidentResponseData data) {
    this.data = data;
  }

  public IncidentResponse data(IncidentResponseData data) {
    this.data = data;
    return this;
  }

  public IncidentResponseData getData() {
    return data;
  }

  public void setData(IncidentResponseData data) {
    this.data = data;
  }

  public IncidentResponse included(List<Object> included) {
    this.included = included;
    return this;
  }

  public IncidentResponse addIncludedItem(Object includedItem) {
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
}
