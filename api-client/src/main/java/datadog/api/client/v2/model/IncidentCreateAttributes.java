package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** The incident's attributes for a create request. */
public class IncidentCreateAttributes extends AbstractModel {
  @Json(name = "customer_impact_scope")
  private String customerImpactScope;

  @RequiredProperty
  @Json(name = "customer_impacted")
  private Boolean customerImpacted;

  @Json(name = "fields")
  private Map<String, Object> fields;

  @Json(name = "notification_handles")
  private List<IncidentNotificationHandle> notificationHandles;

  @RequiredProperty
  @Json(name = "title")
  private String title;

  public IncidentCreateAttributes() {}

  public IncidentCreateAttributes(Boolean customerImpacted, String title) {
    this.customerImpacted = customerImpacted;
    this.title = title;
  }

  public IncidentCreateAttributes customerImpactScope(String customerImpactScope) {
    this.customerImpactScope = customerImpactScope;
    return this;
  }

  /**
   * Required if `customer_impacted:"true"`. A summary of the impact customers experienced during
   * the incident.
   */
  @Nullable
  public String getCustomerImpactScope() {
    return customerImpactScope;
  }

  public boolean hasCustomerImpactScope() {
    return customerImpactScope != null;
  }

  public void setCustomerImpactScope(String customerImpactScope) {
    this.customerImpactScope = customerImpactScope;
  }

  public IncidentCreateAttributes customerImpacted(Boolean customerImpacted) {
    this.customerImpacted = customerImpacted;
    return this;
  }

  /** A flag indicating whether the incident caused customer impact. */
  public Boolean getCustomerImpacted() {
    return customerImpacted;
  }

  public void setCustomerImpacted(Boolean customerImpacted) {
    this.customerImpacted = customerImpacted;
  }

  public IncidentCreateAttributes fields(Map<String, Object> fields) {
    this.fields = fields;
    return this;
  }

  public IncidentCreateAttributes putFieldItem(String key, Object fieldItem) {
    if (this.fields == null) {
      this.fields = new LinkedHashMap<>();
    }
    this.fields.put(key, fieldItem);
    return this;
  }

  /** A condensed view of the user-defined fields for which to create initial selections. */
  @Nullable
  public Map<String, Object> getFields() {
    return fields;
  }

  public boolean hasFields() {
    return fields != null;
  }

  public void setFields(Map<String, Object> fields) {
    this.fields = fields;
  }

  public IncidentCreateAttributes notificationHandles(
      List<IncidentNotificationHandle> notificationHandles) {
    this.notificationHandles = notificationHandles;
    return this;
  }

  public IncidentCreateAttributes addNotificationHandleItem(
      IncidentNotificationHandle notificationHandleItem) {
    if (this.notificationHandles == null) {
      this.notificationHandles = new ArrayList<>();
    }
    this.notificationHandles.add(notificationHandleItem);
    return this;
  }

  /** Notification handles that will be notified of the incident at creation. */
  @Nullable
  public List<IncidentNotificationHandle> getNotificationHandles() {
    return notificationHandles;
  }

  public boolean hasNotificationHandles() {
    return notificationHandles != null;
  }

  public void setNotificationHandles(List<IncidentNotificationHandle> notificationHandles) {
    this.notificationHandles = notificationHandles;
  }

  public IncidentCreateAttributes title(String title) {
    this.title = title;
    return this;
  }

  /** The title of the incident, which summarizes what happened. */
  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }
}
