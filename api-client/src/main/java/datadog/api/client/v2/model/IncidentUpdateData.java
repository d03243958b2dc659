package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import javax.annotation.Nullable;

/** Incident data for an update request. */
public class IncidentUpdateData extends AbstractModel {
  @Json(name = "attributes")
  private IncidentUpdateAttributes attributes;

  @RequiredProperty
  @Json(name = "id")
  private String id;

  @RequiredProperty
  @Json(name = "type")
  private IncidentType type = IncidentType.INCIDENTS;

  public IncidentUpdateData() {}

  public IncidentUpdateData(String id, IncidentType type) {
    this.id = id;
    this.type = type;
  }

  public IncidentUpdateData attributes(IncidentUpdateAttributes attributes) {
    this.attributes = attributes;
    return this;
  }

  @Nullable
  public IncidentUpdateAttributes getAttributes() {
    return attributes;
  }

  public boolean hasAttributes() {
    return attributes != null;
  }

  public void setAttributes(IncidentUpdateAttributes attributes) {
    this.attributes = attributes;
  }

  public IncidentUpdateData id(String id) {
    this.id = id;
    return this;
  }

  /** The team's ID. */
  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public IncidentUpdateData type(IncidentType type) {
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
