package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** The incident's attributes for an update request. */
public class IncidentUpdateAttributes extends AbstractModel {
  @Json(name = "customer_impact_end")
  private OffsetDateTime customerImpactEnd;

  @Json(name = "customer_impact_scope")
  private String customerImpactScope;

  @Json(name = "customer_impact_start")
  private OffsetDateTime customerImpactStart;

  @Json(name = "customer_impacted")
  private Boolean customerImpacted;

  @Json(name = "detected")
  private OffsetDateTime detected;

  @Json(name = "fields")
  private Map<String, Object> fields;

  @Json(name = "notification_handles")
  private List<IncidentNotificationHandle> notificationHandles;

  @Json(name = "title")
  private String title;

  public IncidentUpdateAttributes() {}

  public IncidentUpdateAttributes customerImpactEnd(OffsetDateTime customerImpactEnd) {
    this.customerImpactEnd = customerImpactEnd;
    return this;
  }

  /** Timestamp when customers were no longer impacted by the incident. */
  @Nullable
  public OffsetDateTime getCustomerImpactEnd() {
    return customerImpactEnd;
  }

  public boolean hasCustomerImpactEnd() {
    return customerImpactEnd != null;
  }

  public void setCustomerImpactEnd(OffsetDateTime customerImpactEnd) {
    this.customerImpactEnd = customerImpactEnd;
  }

  public IncidentUpdateAttributes customerImpactScope(String customerImpactScope) {
    this.customerImpactScope = customerImpactScope;
    return this;
  }

  /** A summary of the impact customers experienced during the incident. */
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

  public IncidentUpdateAttributes customerImpactStart(OffsetDateTime customerImpactStart) {
    this.customerImpactStart = customerImpactStart;
    return this;
  }

  /** Timestamp when customers began being impacted by the incident. */
  @Nullable
  public OffsetDateTime getCustomerImpactStart() {
    return customerImpactStart;
  }

  public boolean hasCustomerImpactStart() {
    return customerImpactStart != null;
  }

  public void setCustomerImpactStart(OffsetDateTime customerImpactStart) {
    this.customerImpactStart = customerImpactStart;
  }

  public IncidentUpdateAttributes customerImpacted(Boolean customerImpacted) {
    this.customerImpacted = customerImpacted;
    return this;
  }

  /** A flag indicating whether the incident caused customer impact. */
  @Nullable
  public Boolean getCustomerImpacted() {
    return customerImpacted;
  }

  public boolean hasCustomerImpacted() {
    return customerImpacted != null;
  }

  public void setCustomerImpacted(Boolean customerImpacted) {
    this.customerImpacted = customerImpacted;
  }

  public IncidentUpdateAttributes detected(OffsetDateTime detected) {
    this.detected = detected;
    return this;
  }

  /** Timestamp when the incident was detected. */
  @Nullable
  public OffsetDateTime getDetected() {
    return detected;
  }

  public boolean hasDetected() {
    return detected != null;
  }

  public void setDetected(OffsetDateTime detected) {
    this.detected = detected;
  }

  public IncidentUpdateAttributes fields(Map<String, Object> fields) {
    this.fields = fields;
    return this;
  }

  public IncidentUpdateAttributes putFieldItem(String key, Object fieldItem) {
    if (this.fields == null) {
      this.fields = new LinkedHashMap<>();
    }
    this.fields.put(key, fieldItem);
    return this;
  }

  /** A condensed view of the user-defined fields for which to update selections. */
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

  public IncidentUpdateAttributes notificationHandles(
      List<IncidentNotificationHandle> notificationHandles) {
    this.notificationHandles = notificationHandles;
    return this;
  }

  public IncidentUpdateAttributes addNotificationHandleItem(
      IncidentNotificationHandle notificationHandleItem) {
    if (this.notificationHandles == null) {
      this.notificationHandles = new ArrayList<>();
    }
    this.notificationHandles.add(notificationHandleItem);
    return this;
  }

  /** Notification handles that will be notified of the incident during update. */
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

  public IncidentUpdateAttributes title(String title) {
    this.title = title;
    return this;
  }

  /** The title of the incident, which summarizes what happened. */
  @Nullable
  public String getTitle() {
    return title;
  }

  public boolean hasTitle() {
    return title != null;
  }

  public void setTitle(String title) {
    this.title = title;
  }
}
