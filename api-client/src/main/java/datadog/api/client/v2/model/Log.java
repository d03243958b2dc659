package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Object description of a log after being processed and stored by Datadog. */
public class Log extends AbstractModel {
  @Json(name = "attributes")
  private LogAttributes attributes;

  @Json(name = "id")
  private String id;

  @Json(name = "type")
  private LogType type = LogType.LOG;

  public Log() {}

  public Log attributes(LogAttributes attributes) {
    this.attributes = attributes;
    return this;
  }

  @Nullable
  public LogAttributes getAttributes() {
    return attributes;
  }

  public boolean hasAttributes() {
    return attributes != null;
  }

  public void setAttributes(LogAttributes attributes) {
    this.attributes = attributes;
  }

  public Log id(String id) {
    this.id = id;
    return this;
  }

  /** Unique ID of the Log. */
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

  public Log type(LogType type) {
    this.type = type;
    return this;
  }

  @Nullable
  public LogType getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  public void setType(LogType type) {
    this.type = type;
  }
}
