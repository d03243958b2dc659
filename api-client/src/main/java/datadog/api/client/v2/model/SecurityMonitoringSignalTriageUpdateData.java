package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Data containing the updated triage attributes of the signal. */
public class SecurityMonitoringSignalTriageUpdateData extends AbstractModel {
  @Json(name = "attributes")
  private SecurityMonitoringSignalTriageAttributes attributes;

  @Json(name = "id")
  private String id;

  @Json(name = "type")
  private SecurityMonitoringSignalMetadataType type =
      SecurityMonitoringSignalMetadataType.SIGNAL_METADATA;

  public SecurityMonitoringSignalTriageUpdateData() {}

  public SecurityMonitoringSignalTriageUpdateData attributes(
      SecurityMonitoringSignalTriageAttributes attributes) {
    this.attributes = attributes;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalTriageAttributes getAttributes() {
    return attributes;
  }

  public boolean hasAttributes() {
    return attributes != null;
  }

  public void setAttributes(SecurityMonitoringSignalTriageAttributes attributes) {
    this.attributes = attributes;
  }

  public SecurityMonitoringSignalTriageUpdateData id(String id) {
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

  public SecurityMonitoringSignalTriageUpdateData type(SecurityMonitoringSignalMetadataType type) {
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
