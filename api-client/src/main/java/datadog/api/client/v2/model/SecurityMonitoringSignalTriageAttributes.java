package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Attributes describing a triage state update operation over a security signal. */
public class SecurityMonitoringSignalTriageAttributes extends AbstractModel {
  @Json(name = "archive_comment")
  private String archiveComment;

  @Json(name = "archive_comment_timestamp")
  private Long archiveCommentTimestamp;

  @Json(name = "archive_comment_user")
  private SecurityMonitoringTriageUser archiveCommentUser;

  @Json(name = "archive_reason")
  private SecurityMonitoringSignalArchiveReason archiveReason;

  @RequiredProperty
  @Json(name = "assignee")
  private SecurityMonitoringTriageUser assignee;

  @RequiredProperty
  @Json(name = "incident_ids")
  private List<Long> incidentIds;

  @RequiredProperty
  @Json(name = "state")
  private SecurityMonitoringSignalState state;

  @Json(name = "state_update_timestamp")
  private Long stateUpdateTimestamp;

  @Json(name = "state_update_user")
  private SecurityMonitoringTriageUser stateUpdateUser;

  public SecurityMonitoringSignalTriageAttributes() {}

  public SecurityMonitoringSignalTriageAttributes(
      SecurityMonitoringTriageUser assignee,
      List<Long> incidentIds,
      SecurityMonitoringSignalState state) {
    this.assignee = assignee;
    this.incidentIds = incidentIds;
    this.state = state;
  }

  public SecurityMonitoringSignalTriageAttributes archiveComment(String archiveComment) {
    this.archiveComment = archiveComment;
    return this;
  }

  /** Optional comment to display on archived signals. */
  @Nullable
  public String getArchiveComment() {
    return archiveComment;
  }

  public boolean hasArchiveComment() {
    return archiveComment != null;
  }

  public void setArchiveComment(String archiveComment) {
    this.archiveComment = archiveComment;
  }

  public SecurityMonitoringSignalTriageAttributes archiveCommentTimestamp(
      Long archiveCommentTimestamp) {
    this.archiveCommentTimestamp = archiveCommentTimestamp;
    return this;
  }

  /** Timestamp of the last edit to the comment. */
  @Nullable
  public Long getArchiveCommentTimestamp() {
    return archiveCommentTimestamp;
  }

  public boolean hasArchiveCommentTimestamp() {
    return archiveCommentTimestamp != null;
  }

  public void setArchiveCommentTimestamp(Long archiveCommentTimestamp) {
    this.archiveCommentTimestamp = archiveCommentTimestamp;
  }

  public SecurityMonitoringSignalTriageAttributes archiveCommentUser(
      SecurityMonitoringTriageUser archiveCommentUser) {
    this.archiveCommentUser = archiveCommentUser;
    return this;
  }

  @Nullable
  public SecurityMonitoringTriageUser getArchiveCommentUser() {
    return archiveCommentUser;
  }

  public boolean hasArchiveCommentUser() {
    return archiveCommentUser != null;
  }

  public void setArchiveCommentUser(SecurityMonitoringTriageUser archiveCommentUser) {
    this.archiveCommentUser = archiveCommentUser;
  }

  public SecurityMonitoringSignalTriageAttributes archiveReason(
      SecurityMonitoringSignalArchiveReason archiveReason) {
    this.archiveReason = archiveReason;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalArchiveReason getArchiveReason() {
    return archiveReason;
  }

  public boolean hasArchiveReason() {
    return archiveReason != null;
  }

  public void setArchiveReason(SecurityMonitoringSignalArchiveReason archiveReason) {
    this.archiveReason = archiveReason;
  }

  public SecurityMonitoringSignalTriageAttributes assignee(SecurityMonitoringTriageUser assignee) {
    this.assignee = assignee;
    return this;
  }

  public SecurityMonitoringTriageUser getAssignee() {
    return assignee;
  }

  public void setAssignee(SecurityMonitoringTriageUser assignee) {
    this.assignee = assignee;
  }

  public SecurityMonitoringSignalTriageAttributes incidentIds(List<Long> incidentIds) {
    this.incidentIds = incidentIds;
    return this;
  }

  public SecurityMonitoringSignalTriageAttributes addIncidentIdItem(Long incidentIdItem) {
    if (this.incidentIds == null) {
      this.incidentIds = new ArrayList<>();
    }
    this.incidentIds.add(incidentIdItem);
    return this;
  }

  /** Array of incidents that are associated with this signal. */
  public List<Long> getIncidentIds() {
    return incidentIds;
  }

  public void setIncidentIds(List<Long> incidentIds) {
    this.incidentIds = incidentIds;
  }

  public SecurityMonitoringSignalTriageAttributes state(SecurityMonitoringSignalState state) {
    this.state = state;
    return this;
  }

  public SecurityMonitoringSignalState getState() {
    return state;
  }

  public void setState(SecurityMonitoringSignalState state) {
    this.state = state;
  }

  public SecurityMonitoringSignalTriageAttributes stateUpdateTimestamp(Long stateUpdateTimestamp) {
    this.stateUpdateTimestamp = stateUpdateTimestamp;
    return this;
  }

  /** Timestamp of the last update to the signal state. */
  @Nullable
  public Long getStateUpdateTimestamp() {
    return stateUpdateTimestamp;
  }

  public boolean hasStateUpdateTimestamp() {
    return stateUpdateTimestamp != null;
  }

  public void setStateUpdateTimestamp(Long stateUpdateTimestamp) {
    this.stateUpdateTimestamp = stateUpdateTimestamp;
  }

  public SecurityMonitoringSignalTriageAttributes stateUpdateUser(
      SecurityMonitoringTriageUser stateUpdateUser) {
    this.stateUpdateUser = stateUpdateUser;
    return this;
  }

  @Nullable
  public SecurityMonitoringTriageUser getStateUpdateUser() {
    return stateUpdateUser;
  }

  public boolean hasStateUpdateUser() {
    return stateUpdateUser != null;
  }

  public void setStateUpdateUser(SecurityMonitoringTriageUser stateUpdateUser) {
    this.stateUpdateUser = stateUpdateUser;
  }
}
