package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Object description of a RUM event after being processed and stored by Datadog. */
public class RUMEvent extends AbstractModel {
  @Json(name = "attributes")
  private RUMEventAttributes attributes;

  @Json(name = "id")
  private String id;

  @Json(name = "type")
  private RUMEventType type = RUMEventType.RUM;

  public RUMEvent() {}

  public RUMEvent attributes(RUMEventAttributes attributes) {
    this.attributes = attributes;
    return this;
  }

  @Nullable
  public RUMEventAttributes getAttributes() {
    return attributes;
  }

  public boolean hasAttributes() {
    return attributes != null;
  }

  public void setAttributes(RUMEventAttributes attributes) {
    this.attributes = attributes;
  }

  public RUMEvent id(String id) {
    this.id = id;
    return this;
  }

  /** Unique ID of the event. */
  @Nullable
  public String getId() {
    return id;
  }

  public boolean hasId() {
    return id != null;
  }

  public void setId(String id) {
    this.id = id;
  }

  public RUMEvent type(RUMEventType type) {
    this.type = type;
    return this;
  }

  @Nullable
  public RUMEventType getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  public void setType(RUMEventType type) {
    this.type = type;
  }
}
