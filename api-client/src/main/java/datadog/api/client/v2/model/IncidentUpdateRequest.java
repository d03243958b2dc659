package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;

/** Update request for an incident. */
public class IncidentUpdateRequest extends AbstractModel {
  @RequiredProperty
  @Json(name = "data")
  private IncidentUpdateData data;

  public IncidentUpdateRequest() {}

  public IncidentUpdateRequest(IncidentUpdateData data) {
    this.data = data;
  }

  public IncidentUpdateRequest data(IncidentUpdateData data) {
    this.data = data;
    return this;
  }

  public IncidentUpdateData getData() {
    return data;
  }

  public void setData(IncidentUpdateData data) {
    this.data = data;
  }
}
