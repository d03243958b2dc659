package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;

/** Incident data for a create request. */
public class IncidentCreateData extends AbstractModel {
  @RequiredProperty
  @Json(name = "attributes")
  private IncidentCreateAttributes attributes;

  @RequiredProperty
  @Json(name = "type")
  private IncidentType type = IncidentType.INCIDENTS;

  public IncidentCreateData() {}

  public IncidentCreateData(IncidentCreateAttributes attributes, IncidentType type) {
    this.attributes = attributes;
    this.type = type;
  }

  public IncidentCreateData attributes(IncidentCreateAttributes attributes) {
    this.attributes = attributes;
    return this;
  }

  public IncidentCreateAttributes getAttributes() {
    return attributes;
  }

  public void setAttributes(IncidentCreateAttributes attributes) {
    this.attributes = attributes;
  }

  public IncidentCreateData type(IncidentType type) {
    this.type = type;
    return this;
  }

  public IncidentType getType() {
    return type;
  }

  public void setType(IncidentType type) {
    this.type = type;
  }
}
