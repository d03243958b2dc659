package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** A notification handle that will be notified at incident creation. */
public class IncidentNotificationHandle extends AbstractModel {
  @Json(name = "display_name")
  private String displayName;

  @Json(name = "handle")
  private String handle;

  public IncidentNotificationHandle() {}

  public IncidentNotificationHandle displayName(String displayName) {
    this.displayName = displayName;
    return this;
  }

  /** The name of the notified handle. */
  @Nullable
  public String getDisplayName() {
    return displayName;
  }

  public boolean hasDisplayName() {
    return displayName != null;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }

  public IncidentNotificationHandle handle(String handle) {
    this.handle = handle;
    return this;
  }

  /** The email address used for the notification. */
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
}
