package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import javax.annotation.Nullable;

/** Object representing a given user entity. */
public class SecurityMonitoringTriageUser extends AbstractModel {
  @Json(name = "handle")
  private String handle;

  @Json(name = "icon")
  private String icon;

  @Json(name = "id")
  private Long id;

  @Json(name = "name")
  private String name;

  @RequiredProperty
  @Json(name = "uuid")
  private String uuid;

  public SecurityMonitoringTriageUser() {}

  public SecurityMonitoringTriageUser(String uuid) {
    this.uuid = uuid;
  }

  public SecurityMonitoringTriageUser handle(String handle) {
    this.handle = handle;
    return this;
  }

  /** The handle for this user account. */
  @Nullable
  public String getHandle() {
    return handle;
  }

  public boolean hasHandle() {
    return handle != null;
  }

  public void setHandle(String handle) {
    this.handle = handle;
  }

  public SecurityMonitoringTriageUser icon(String icon) {
    this.icon = icon;
    return this;
  }

  /** Gravatar icon associated to the user. */
  @Nullable
  public String getIcon() {
    return icon;
  }

  public boolean hasIcon() {
    return icon != null;
  }

  public void setIcon(String icon) {
    this.icon = icon;
  }

  public SecurityMonitoringTriageUser id(Long id) {
    this.id = id;
    return this;
  }

  /** Numerical ID assigned by Datadog to this user account. */
  @Nullable
  public Long getId() {
    return id;
  }

  public boolean hasId() {
    return id != null;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public SecurityMonitoringTriageUser name(String name) {
    this.name = name;
    return this;
  }

  /** The name for this user account. */
  @Nullable
  public String getName() {
    return name;
  }

  public boolean hasName() {
    return name != null;
  }

  public void setName(String name) {
    this.name = name;
  }

  public SecurityMonitoringTriageUser uuid(String uuid) {
    this.uuid = uuid;
    return this;
  }

  /** UUID assigned by Datadog to this user account. */
  public String getUuid() {
    return uuid;
  }

  public void setUuid(String uuid) {
    this.uuid = uuid;
  }
}
