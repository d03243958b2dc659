package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import javax.annotation.Nullable;

/** Data containing the patch for changing the state of a signal. */
public class SecurityMonitoringSignalStateUpdateData extends AbstractModel {
  @RequiredProperty
  @Json(name = "attributes")
  private SecurityMonitoringSignalStateUpdateAttributes attributes;

  @Json(name = "id")
  private String id;

  @Json(name = "type")
  private SecurityMonitoringSignalMetadataType type =
      SecurityMonitoringSignalMetadataType.SIGNAL_METADATA;

  public SecurityMonitoringSignalStateUpdateData() {}

  public SecurityMonitoringSignalStateUpdateData(
      SecurityMonitoringSignalStateUpdateAttributes attributes) {
    this.attributes = attributes;
  }

  public SecurityMonitoringSignalStateUpdateData attributes(
      SecurityMonitoringSignalStateUpdateAttributes attributes) {
    this.attributes = attributes;
    return this;
  }

  public SecurityMonitoringSignalStateUpdateAttributes getAttributes() {
    return attributes;
  }

  public void setAttributes(SecurityMonitoringSignalStateUpdateAttributes attributes) {
    this.attributes = attributes;
  }

  public SecurityMonitoringSignalStateUpdateData id(String id) {
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

  public SecurityMonitoringSignalStateUpdateData type(SecurityMonitoringSignalMetadataType type) {
    this.type = type;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalMetadataType getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  public void setType(SecurityMonitoringSignalMetadataType type) {
    this.type = type;
  }
}
