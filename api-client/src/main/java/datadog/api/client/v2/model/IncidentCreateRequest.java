package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;

/** Create request for an incident. */
public class IncidentCreateRequest extends AbstractModel {
  @RequiredProperty
  @Json(name = "data")
  private IncidentCreateData data;

  public IncidentCreateRequest() {}

  public IncidentCreateRequest(IncidentCreateData data) {
    this.data = data;
  }

  public IncidentCreateRequest data(IncidentCreateData data) {
    this.data = data;
    return this;
  }

  public IncidentCreateData getData() {
    return data;
  }

  public void setData(IncidentCreateData data) {
    this.data = data;
  }
}
