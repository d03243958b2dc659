package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Case when signal is generated. */
public class SecurityMonitoringRuleCase extends AbstractModel {
  @Json(name = "condition")
  private String condition;

  @Json(name = "name")
  private String name;

  @Json(name = "notifications")
  private List<String> notifications;

  @Json(name = "status")
  private SecurityMonitoringRuleSeverity status;

  public SecurityMonitoringRuleCase() {}

  public SecurityMonitoringRuleCase condition(String condition) {
    this.condition = condition;
    return this;
  }

  /**
   * A rule case contains logical operations (`>`,`>=`, `&&`, `||`) to determine if a signal should
   * be generated based on the event counts in the previously defined queries.
   */
  @Nullable
  public String getCondition() {
    return condition;
  }

  public boolean hasCondition() {
    return condition != null;
  }

  public void setCondition(String condition) {
    this.condition = condition;
  }

  public SecurityMonitoringRuleCase name(String name) {
    this.name = name;
    return this;
  }

  /** Name of the case. */
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

  public SecurityMonitoringRuleCase notifications(List<String> notifications) {
    this.notifications = notifications;
    return this;
  }

  public SecurityMonitoringRuleCase addNotificationItem(String notificationItem) {
    if (this.notifications == null) {
      this.notifications = new ArrayList<>();
    }
    this.notifications.add(notificationItem);
    return this;
  }

  /** Notification targets for each rule case. */
  @Nullable
  public List<String> getNotifications() {
    return notifications;
  }

  public boolean hasNotifications() {
    return notifications != null;
  }

  public void setNotifications(List<String> notifications) {
    this.notifications = notifications;
  }

  public SecurityMonitoringRuleCase status(SecurityMonitoringRuleSeverity status) {
    this.status = status;
    return this;
  }

  @Nullable
  public SecurityMonitoringRuleSeverity getStatus() {
    return status;
  }

  public boolean hasStatus() {
    return status != null;
  }

  public void setStatus(SecurityMonitoringRuleSeverity status) {
    this.status = status;
  }
}
