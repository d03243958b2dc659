package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Object description of a security signal. */
public class SecurityMonitoringSignal extends AbstractModel {
  @Json(name = "attributes")
  private SecurityMonitoringSignalAttributes attributes;

  @Json(name = "id")
  private String id;

  @Json(name = "type")
  private SecurityMonitoringSignalType type = SecurityMonitoringSignalType.SIGNAL;

  public SecurityMonitoringSignal() {}

  public SecurityMonitoringSignal attributes(SecurityMonitoringSignalAttributes attributes) {
    this.attributes = attributes;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalAttributes getAttributes() {
    return attributes;
  }

  public boolean hasAttributes() {
    return attributes != null;
  }

  public void setAttributes(SecurityMonitoringSignalAttributes attributes) {
    this.attributes = attributes;
  }

  public SecurityMonitoringSignal id(String id) {
    this.id = id;
    return this;
  }

  /** The unique ID of the security signal. */
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

  public SecurityMonitoringSignal type(SecurityMonitoringSignalType type) {
    this.type = type;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalType getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  public void setType(SecurityMonitoringSignalType type) {
    this.type = type;
  }
}
