package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** The incident's attributes from a response. */
public class IncidentResponseAttributes extends AbstractModel {
  @Json(name = "created")
  private OffsetDateTime created;

  @Json(name = "customer_impact_duration")
  private Long customerImpactDuration;

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

  @Json(name = "modified")
  private OffsetDateTime modified;

  @Json(name = "notification_handles")
  private List<IncidentNotificationHandle> notificationHandles;

  @Json(name = "public_id")
  private Long publicId;

  @Json(name = "resolved")
  private OffsetDateTime resolved;

  @Json(name = "time_to_detect")
  private Long timeToDetect;

  @Json(name = "time_to_internal_response")
  private Long timeToInternalResponse;

  @Json(name = "time_to_repair")
  private Long timeToRepair;

  @Json(name = "time_to_resolve")
  private Long timeToResolve;

  @RequiredProperty
  @Json(name = "title")
  private String title;

  public IncidentResponseAttributes() {}

  public IncidentResponseAttributes(String title) {
    this.title = title;
  }

  public IncidentResponseAttributes created(OffsetDateTime created) {
    this.created = created;
    return this;
  }

  /** Timestamp when the incident was created. */
  @Nullable
  public OffsetDateTime getCreated() {
    return created;
  }

  public boolean hasCreated() {
    return created != null;
  }

  public void setCreated(OffsetDateTime created) {
    this.created = created;
  }

  public IncidentResponseAttributes customerImpactDuration(Long customerImpactDuration) {
    this.customerImpactDuration = customerImpactDuration;
    return this;
  }

  /**
   * Length of the incident's customer impact in seconds. Equals the difference between
   * `customer_impact_start` and `customer_impact_end`.
   */
  @Nullable
  public Long getCustomerImpactDuration() {
    return customerImpactDuration;
  }

  public boolean hasCustomerImpactDuration() {
    return customerImpactDuration != null;
  }

  public void setCustomerImpactDuration(Long customerImpactDuration) {
    this.customerImpactDuration = customerImpactDuration;
  }

  public IncidentResponseAttributes customerImpactEnd(OffsetDateTime customerImpactEnd) {
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

  public IncidentResponseAttributes customerImpactScope(String customerImpactScope) {
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

  public IncidentResponseAttributes customerImpactStart(OffsetDateTime customerImpactStart) {
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

  public IncidentResponseAttributes customerImpacted(Boolean customerImpacted) {
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

  public IncidentResponseAttributes detected(OffsetDateTime detected) {
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

  public IncidentResponseAttributes fields(Map<String, Object> fields) {
    this.fields = fields;
    return this;
  }

  public IncidentResponseAttributes putFieldItem(String key, Object fieldItem) {
    if (this.fields == null) {
      this.fields = new LinkedHashMap<>();
    }
    this.fields.put(key, fieldItem);
    return this;
  }

  /** A condensed view of the user-defined fields attached to incidents. */
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

  public IncidentResponseAttributes modified(OffsetDateTime modified) {
    this.modified = modified;
    return this;
  }

  /** Timestamp when the incident was last modified. */
  @Nullable
  public OffsetDateTime getModified() {
    return modified;
  }

  public boolean hasModified() {
    return modified != null;
  }

  public void setModified(OffsetDateTime modified) {
    this.modified = modified;
  }

  public IncidentResponseAttributes notificationHandles(
      List<IncidentNotificationHandle> notificationHandles) {
    this.notificationHandles = notificationHandles;
    return this;
  }

  public IncidentResponseAttributes addNotificationHandleItem(
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

  public IncidentResponseAttributes publicId(Long publicId) {
    this.publicId = publicId;
    return this;
  }

  /** The monotonically increasing integer ID for the incident. */
  @Nullable
  public Long getPublicId() {
    return publicId;
  }

  public boolean hasPublicId() {
    return publicId != null;
  }

  public void setPublicId(Long publicId) {
    this.publicId = publicId;
  }

  public IncidentResponseAttributes resolved(OffsetDateTime resolved) {
    this.resolved = resolved;
    return this;
  }

  /**
   * Timestamp when the incident's state was last changed from active or stable to resolved or
   * completed.
   */
  @Nullable
  public OffsetDateTime getResolved() {
    return resolved;
  }

  public boolean hasResolved() {
    return resolved != null;
  }

  public void setResolved(OffsetDateTime resolved) {
    this.resolved = resolved;
  }

  public IncidentResponseAttributes timeToDetect(Long timeToDetect) {
    this.timeToDetect = timeToDetect;
    return this;
  }

  /** The amount of time in seconds to detect the incident. */
  @Nullable
  public Long getTimeToDetect() {
    return timeToDetect;
  }

  public boolean hasTimeToDetect() {
    return timeToDetect != null;
  }

  public void setTimeToDetect(Long timeToDetect) {
    this.timeToDetect = timeToDetect;
  }

  public IncidentResponseAttributes timeToInternalResponse(Long timeToInternalResponse) {
    this.timeToInternalResponse = timeToInternalResponse;
    return this;
  }

  /** The amount of time in seconds to call incident after detection. */
  @Nullable
  public Long getTimeToInternalResponse() {
    return timeToInternalResponse;
  }

  public boolean hasTimeToInternalResponse() {
    return timeToInternalResponse != null;
  }

  public void setTimeToInternalResponse(Long timeToInternalResponse) {
    this.timeToInternalResponse = timeToInternalResponse;
  }

  public IncidentResponseAttributes timeToRepair(Long timeToRepair) {
    this.timeToRepair = timeToRepair;
    return this;
  }

  /** The amount of time in seconds to resolve customer impact after detecting the issue. */
  @Nullable
  public Long getTimeToRepair() {
    return timeToRepair;
  }

  public boolean hasTimeToRepair() {
    return timeToRepair != null;
  }

  public void setTimeToRepair(Long timeToRepair) {
    this.timeToRepair = timeToRepair;
  }

  public IncidentResponseAttributes timeToResolve(Long timeToResolve) {
    this.timeToResolve = timeToResolve;
    return this;
  }

  /** The amount of time in seconds to resolve the incident after it was created. */
  @Nullable
  public Long getTimeToResolve() {
    return timeToResolve;
  }

  public boolean hasTimeToResolve() {
    return timeToResolve != null;
  }

  public void setTimeToResolve(Long timeToResolve) {
    this.timeToResolve = timeToResolve;
  }

  public IncidentResponseAttributes title(String title) {
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
