package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import javax.annotation.Nullable;

/** Incident data from a response. */
public class IncidentResponseData extends AbstractModel {
  @Json(name = "attributes")
  private IncidentResponseAttributes attributes;

  @RequiredProperty
  @Json(name = "id")
  private String id;

  @RequiredProperty
  @Json(name = "type")
  private IncidentType type = IncidentType.INCIDENTS;

  public IncidentResponseData() {}

  public IncidentResponseData(String id, IncidentType type) {
    this.id = id;
    this.type = type;
  }

  public IncidentResponseData attributes(IncidentResponseAttributes attributes) {
    this.attributes = attributes;
    return this;
  }

  @Nullable
  public IncidentResponseAttributes getAttributes() {
    return attributes;
  }

  public boolean hasAttributes() {
    return attributes != null;
  }

  public void setAttributes(IncidentResponseAttributes attributes) {
    this.attributes = attributes;
  }

  public IncidentResponseData id(String id) {
    this.id = id;
    return this;
  }

  /** The incident's ID. */
  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public IncidentResponseData type(IncidentType type) {
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
